package io.jagged.generator.impl;

import io.jagged.generator.api.ContentGenerator;
import io.jagged.generator.api.DecisionTape;
import io.jagged.generator.api.GeneratorOptions;
import io.jagged.generator.leaf.LeafGenerators;
import io.jagged.layout.Content;
import io.jagged.layout.Contents;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ContentGenerator}. Resolves the enabled kinds once and runs one {@link
 * TreeBuilder} per pass.
 */
public final class ContentGeneratorImpl implements ContentGenerator {
  private static final Logger log = LoggerFactory.getLogger(ContentGeneratorImpl.class);

  private final GeneratorOptions options;
  private final LeafGenerators leaves;
  private final Set<NodeKind> enabled;

  public ContentGeneratorImpl(GeneratorOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    options.validate();
    this.leaves = LeafGenerators.from(options);
    this.enabled = Collections.unmodifiableSet(enabledKinds(options));
    log.debug(
        "Content generator ready: leaves={}, nodes={}, maxSize={}, maxDepth={}, maxLength={}",
        leaves.kinds(),
        enabled,
        options.maxSize(),
        options.maxDepth(),
        options.maxLength() == GeneratorOptions.UNBOUNDED ? "unbounded" : options.maxLength());
  }

  private static Set<NodeKind> enabledKinds(GeneratorOptions options) {
    Set<NodeKind> kinds = EnumSet.noneOf(NodeKind.class);
    if (options.allowRegular()) {
      kinds.add(NodeKind.REGULAR);
    }
    if (options.allowListOffset()) {
      kinds.add(NodeKind.LIST_OFFSET);
    }
    if (options.allowList()) {
      kinds.add(NodeKind.LIST);
    }
    if (options.allowRecord()) {
      kinds.add(NodeKind.RECORD);
    }
    if (options.allowUnion()) {
      kinds.add(NodeKind.UNION);
    }
    return kinds;
  }

  @Override
  public GeneratorOptions options() {
    return options;
  }

  @Override
  public Content generate(DecisionTape tape) {
    ScalarBudget budget = new ScalarBudget(options.maxSize());
    Content tree = new TreeBuilder(options, leaves, enabled, tape, budget).build();
    if (log.isTraceEnabled()) {
      log.trace(
          "Generated {} (depth={}, scalars={})",
          tree.kind(),
          Contents.nestingDepth(tree),
          budget.used());
    }
    return tree;
  }

  @Override
  public List<Content> generateList(DecisionTape tape, int minItems, int maxItems) {
    if (minItems < 0 || maxItems < minItems) {
      throw new IllegalArgumentException(
          "Invalid item range [" + minItems + ", " + maxItems + "]");
    }
    ScalarBudget budget = new ScalarBudget(options.maxSize());
    TreeBuilder builder = new TreeBuilder(options, leaves, enabled, tape, budget);
    List<Content> items = new ArrayList<>();
    while (items.size() < minItems) {
      items.add(builder.build());
    }
    while (items.size() < maxItems && !budget.isExhausted() && tape.drawBoolean()) {
      items.add(builder.build());
    }
    return items;
  }
}
