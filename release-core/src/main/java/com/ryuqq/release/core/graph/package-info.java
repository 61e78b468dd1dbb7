/**
 * Dependency graph package.
 *
 * <p>Pure traversals over a name-keyed graph. Nodes and edges are plain maps keyed by
 * {@link com.ryuqq.release.core.model.ServiceName}, never mutually-referencing objects.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.release.core.graph.DependencyGraphBuilder} - Builds the graph, validates declarations</li>
 *   <li>{@link com.ryuqq.release.core.graph.CycleDetector} - DFS cycle detection (all cycles)</li>
 *   <li>{@link com.ryuqq.release.core.graph.TopologicalSorter} - Kahn leveling into deployment batches</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * DependencyGraphBuilder.validateDependencies(services).throwIfInvalid();
 * DependencyGraph graph = DependencyGraphBuilder.buildGraph(services);
 * if (CycleDetector.hasCycles(graph)) { ... }
 * List&lt;Batch&gt; batches = TopologicalSorter.topologicalSort(graph);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.release.core.graph;
