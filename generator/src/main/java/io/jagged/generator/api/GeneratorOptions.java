package io.jagged.generator.api;

/**
 * Configuration of a {@link ContentGenerator}.
 *
 * @param dtypes dtype source for numeric leaves
 * @param allowNan whether numeric leaves may hold NaN and NaT values
 * @param allowNumpy whether numeric leaves are generated
 * @param allowEmpty whether zero-length placeholder leaves are generated
 * @param allowString whether text leaves are generated
 * @param allowBytestring whether byte-string leaves are generated
 * @param allowRegular whether fixed-size groupings are generated
 * @param allowListOffset whether offset-delimited lists are generated
 * @param allowList whether start/stop-delimited lists are generated
 * @param allowRecord whether records and tuples are generated
 * @param allowUnion whether tagged unions are generated
 * @param allowTuple whether records may omit field names
 * @param maxSize total number of leaf elements across the whole tree
 * @param maxLength ceiling on the immediate length of every node
 * @param maxDepth ceiling on the number of nested branching nodes
 * @param maxFields largest number of fields in a record
 * @param maxContents largest number of alternatives in a union
 * @param maxStringLength longest text (in code points) or byte string in a leaf
 */
public record GeneratorOptions(
    DTypeSource dtypes,
    boolean allowNan,
    boolean allowNumpy,
    boolean allowEmpty,
    boolean allowString,
    boolean allowBytestring,
    boolean allowRegular,
    boolean allowListOffset,
    boolean allowList,
    boolean allowRecord,
    boolean allowUnion,
    boolean allowTuple,
    int maxSize,
    int maxLength,
    int maxDepth,
    int maxFields,
    int maxContents,
    int maxStringLength) {

  /** Value of {@link #maxLength()} meaning no per-node length ceiling. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  public static final int DEFAULT_MAX_SIZE = 10;
  public static final int DEFAULT_MAX_DEPTH = 5;

  /** Every kind enabled, ten scalars, depth five. */
  public static final GeneratorOptions DEFAULT = builder().build();

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder initialised from these options.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder()
        .dtypes(dtypes)
        .allowNan(allowNan)
        .allowNumpy(allowNumpy)
        .allowEmpty(allowEmpty)
        .allowString(allowString)
        .allowBytestring(allowBytestring)
        .allowRegular(allowRegular)
        .allowListOffset(allowListOffset)
        .allowList(allowList)
        .allowRecord(allowRecord)
        .allowUnion(allowUnion)
        .allowTuple(allowTuple)
        .maxSize(maxSize)
        .maxLength(maxLength)
        .maxDepth(maxDepth)
        .maxFields(maxFields)
        .maxContents(maxContents)
        .maxStringLength(maxStringLength);
  }

  public boolean anyLeafAllowed() {
    return allowNumpy || allowEmpty || allowString || allowBytestring;
  }

  public boolean anyNestingAllowed() {
    return allowRegular || allowListOffset || allowList || allowRecord || allowUnion;
  }

  /**
   * Checks that these options can produce at least one value.
   *
   * @throws JaggedConfigurationException if they cannot
   */
  public void validate() {
    if (dtypes == null) {
      throw new JaggedConfigurationException("dtype source cannot be null", "dtypes");
    }
    if (!anyLeafAllowed()) {
      throw JaggedConfigurationException.noLeafKind();
    }
    if (maxSize < 0) {
      throw JaggedConfigurationException.negative("maxSize", maxSize);
    }
    if (maxLength < 0) {
      throw JaggedConfigurationException.negative("maxLength", maxLength);
    }
    if (maxDepth < 0) {
      throw JaggedConfigurationException.negative("maxDepth", maxDepth);
    }
    if (maxStringLength < 0) {
      throw JaggedConfigurationException.negative("maxStringLength", maxStringLength);
    }
    if (maxFields < 1) {
      throw new JaggedConfigurationException(
          "'maxFields' must be at least 1, got " + maxFields, "maxFields");
    }
    if (maxContents < 2 || maxContents > 128) {
      throw new JaggedConfigurationException(
          "'maxContents' must be between 2 and 128, got " + maxContents, "maxContents");
    }
  }

  /** Fluent builder, every kind enabled by default. */
  public static class Builder {
    private DTypeSource dtypes = DTypeSource.all();
    private boolean allowNan = false;
    private boolean allowNumpy = true;
    private boolean allowEmpty = true;
    private boolean allowString = true;
    private boolean allowBytestring = true;
    private boolean allowRegular = true;
    private boolean allowListOffset = true;
    private boolean allowList = true;
    private boolean allowRecord = true;
    private boolean allowUnion = true;
    private boolean allowTuple = true;
    private int maxSize = DEFAULT_MAX_SIZE;
    private int maxLength = UNBOUNDED;
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private int maxFields = 5;
    private int maxContents = 4;
    private int maxStringLength = 8;

    public Builder dtypes(DTypeSource value) {
      this.dtypes = value;
      return this;
    }

    public Builder allowNan(boolean value) {
      this.allowNan = value;
      return this;
    }

    public Builder allowNumpy(boolean value) {
      this.allowNumpy = value;
      return this;
    }

    public Builder allowEmpty(boolean value) {
      this.allowEmpty = value;
      return this;
    }

    public Builder allowString(boolean value) {
      this.allowString = value;
      return this;
    }

    public Builder allowBytestring(boolean value) {
      this.allowBytestring = value;
      return this;
    }

    public Builder allowRegular(boolean value) {
      this.allowRegular = value;
      return this;
    }

    public Builder allowListOffset(boolean value) {
      this.allowListOffset = value;
      return this;
    }

    public Builder allowList(boolean value) {
      this.allowList = value;
      return this;
    }

    public Builder allowRecord(boolean value) {
      this.allowRecord = value;
      return this;
    }

    public Builder allowUnion(boolean value) {
      this.allowUnion = value;
      return this;
    }

    public Builder allowTuple(boolean value) {
      this.allowTuple = value;
      return this;
    }

    /** Disables every structural kind so only leaves are generated. */
    public Builder leavesOnly() {
      return allowRegular(false)
          .allowListOffset(false)
          .allowList(false)
          .allowRecord(false)
          .allowUnion(false);
    }

    public Builder maxSize(int value) {
      this.maxSize = value;
      return this;
    }

    public Builder maxLength(int value) {
      this.maxLength = value;
      return this;
    }

    public Builder maxDepth(int value) {
      this.maxDepth = value;
      return this;
    }

    public Builder maxFields(int value) {
      this.maxFields = value;
      return this;
    }

    public Builder maxContents(int value) {
      this.maxContents = value;
      return this;
    }

    public Builder maxStringLength(int value) {
      this.maxStringLength = value;
      return this;
    }

    public GeneratorOptions build() {
      return new GeneratorOptions(
          dtypes,
          allowNan,
          allowNumpy,
          allowEmpty,
          allowString,
          allowBytestring,
          allowRegular,
          allowListOffset,
          allowList,
          allowRecord,
          allowUnion,
          allowTuple,
          maxSize,
          maxLength,
          maxDepth,
          maxFields,
          maxContents,
          maxStringLength);
    }
  }
}
