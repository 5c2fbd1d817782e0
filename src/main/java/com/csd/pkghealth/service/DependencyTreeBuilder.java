package com.csd.pkghealth.service;

import com.csd.pkghealth.config.AnalyzerProperties;
import com.csd.pkghealth.model.DependencyTreeNode;
import com.csd.pkghealth.model.DependencyTreeResult;
import com.csd.pkghealth.model.PackageMetadata;
import com.csd.pkghealth.model.SkipReason;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves a manifest into its transitive dependency tree against the registry.
 * <p>
 * Siblings are expanded concurrently while registry fetches are gated by a shared
 * {@link FetchLimiter}. A child whose fetch fails, times out or has no resolvable version
 * is dropped and counted by {@link SkipReason}; nothing below the root makes the build fail.
 * <p>
 * Traversal state is reset by every {@link #buildTree} call, so one instance serves one
 * build at a time. Scans running in parallel use separate builders sharing the cache.
 */
@Slf4j
public class DependencyTreeBuilder {

    private final AnalyzerProperties.DependencyTree config;
    private final PackageCache cache;
    private final MetadataFetcher fetcher;
    private final FetchLimiter limiter;

    // name -> versions already expanded
    private final Map<String, Set<String>> visited = new ConcurrentHashMap<>();
    // name -> every version seen in this build
    private final Map<String, Set<String>> packageVersions = new ConcurrentHashMap<>();
    private final Map<SkipReason, Integer> skipCounts = new ConcurrentHashMap<>();

    public DependencyTreeBuilder(AnalyzerProperties.DependencyTree config, PackageCache cache, MetadataFetcher fetcher) {
        this(config, cache, fetcher, new FetchLimiter(config.getMaxConcurrentFetches()));
    }

    /**
     * @param limiter gate shared with other registry callers
     */
    public DependencyTreeBuilder(AnalyzerProperties.DependencyTree config, PackageCache cache, MetadataFetcher fetcher,
                                 FetchLimiter limiter) {
        this.config = config;
        this.cache = cache;
        this.fetcher = fetcher;
        this.limiter = limiter;
    }

    public DependencyTreeResult buildTree(String rootName, String rootVersion, Map<String, String> dependencies) {
        return buildTreeAsync(rootName, rootVersion, dependencies).join();
    }

    public CompletableFuture<DependencyTreeResult> buildTreeAsync(String rootName, String rootVersion,
                                                                  Map<String, String> dependencies) {
        visited.clear();
        packageVersions.clear();
        skipCounts.clear();
        trackVersion(rootName, rootVersion);

        Map<String, String> declared = dependencies != null ? dependencies : Map.of();
        return buildChildren(rootName, rootVersion, 0, declared, List.of())
                .thenApply(children -> {
                    DependencyTreeNode root = DependencyTreeNode.builder()
                            .name(rootName)
                            .version(rootVersion)
                            .depth(0)
                            .dependencies(children)
                            .build();
                    Map<SkipReason, Integer> skips = new EnumMap<>(SkipReason.class);
                    skips.putAll(skipCounts);
                    DependencyTreeResult result = new DependencyTreeResult(root, root.countNodes(),
                            Collections.unmodifiableMap(skips));
                    log.info("Built dependency tree for {}@{}: {} nodes, {} skipped",
                            rootName, rootVersion, result.getTotalNodes(), result.getSkippedCount());
                    return result;
                });
    }

    /**
     * Flattens a tree into name -> version. When a package occurs more than once the last
     * visited occurrence wins.
     */
    public static Map<String, String> collectUniquePackages(DependencyTreeNode tree) {
        Map<String, String> packages = new LinkedHashMap<>();
        tree.walk(node -> packages.put(node.getName(), node.getVersion()));
        return packages;
    }

    public FetchLimiter getLimiter() {
        return limiter;
    }

    private CompletableFuture<List<DependencyTreeNode>> buildChildren(String parentName, String parentVersion, int depth,
                                                                      Map<String, String> dependencies, List<String> path) {
        if (!config.isAnalyzeTransitive() && depth >= 1) {
            return CompletableFuture.completedFuture(List.of());
        }
        if (config.getMaxDepth() > 0 && depth >= config.getMaxDepth()) {
            return CompletableFuture.completedFuture(List.of());
        }
        if (dependencies.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        List<String> currentPath = new ArrayList<>(path);
        currentPath.add(parentName + "@" + parentVersion);
        List<String> ancestors = Collections.unmodifiableList(currentPath);

        List<CompletableFuture<ChildResolution>> pending = dependencies.entrySet().stream()
                .map(dep -> resolveChild(dep.getKey(), dep.getValue(), parentName, depth + 1, ancestors))
                .collect(Collectors.toList());

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> pending.stream()
                        .map(CompletableFuture::join)
                        .filter(ChildResolution::isResolved)
                        .map(ChildResolution::getNode)
                        .collect(Collectors.toUnmodifiableList()));
    }

    private CompletableFuture<ChildResolution> resolveChild(String name, String range, String parentName,
                                                            int depth, List<String> ancestors) {
        boolean circular = isCircular(name, ancestors);
        if (circular && config.isDetectCircular() && config.isStopOnCircular()) {
            log.debug("Stopping at circular dependency {} via {}", name, ancestors);
            return CompletableFuture.completedFuture(skip(name, SkipReason.CIRCULAR_STOPPED));
        }

        return fetchWithCache(name)
                .handle((metadata, error) -> {
                    if (error != null) {
                        SkipReason reason = isTimeout(error) ? SkipReason.TIMEOUT : SkipReason.FETCH_FAILED;
                        log.warn("Skipping {} ({}): {}", name, reason, rootCause(error).toString());
                        return CompletableFuture.completedFuture(skip(name, reason));
                    }
                    return expand(name, range, metadata, parentName, depth, ancestors, circular);
                })
                .thenCompose(Function.identity());
    }

    private CompletableFuture<ChildResolution> expand(String name, String range, PackageMetadata metadata,
                                                      String parentName, int depth, List<String> ancestors,
                                                      boolean circular) {
        String version = resolveVersion(metadata, range);
        if (version == null) {
            log.debug("No resolvable version for {}@{}", name, range);
            return CompletableFuture.completedFuture(skip(name, SkipReason.UNRESOLVABLE_VERSION));
        }

        trackVersion(name, version);
        boolean firstVisit = visited.computeIfAbsent(name, k -> ConcurrentHashMap.newKeySet()).add(version);

        Set<String> seenVersions = packageVersions.getOrDefault(name, Set.of());
        boolean duplicate = config.isDetectDuplicates() && seenVersions.size() > 1;

        DependencyTreeNode.DependencyTreeNodeBuilder node = DependencyTreeNode.builder()
                .name(name)
                .version(version)
                .depth(depth)
                .parent(parentName)
                .circular(circular)
                .duplicate(duplicate)
                .duplicateVersions(duplicate ? sortedVersions(seenVersions) : null)
                .circularPath(circular ? ancestors : null);

        if (!firstVisit || circular) {
            return CompletableFuture.completedFuture(ChildResolution.resolved(node.build()));
        }

        Map<String, String> childDependencies = metadata.dependenciesOf(version);
        return buildChildren(name, version, depth, childDependencies, ancestors)
                .thenApply(children -> ChildResolution.resolved(node.dependencies(children).build()));
    }

    /**
     * Exact published version, else the {@code latest} tag, else the highest published version.
     */
    public static String resolveVersion(PackageMetadata metadata, String range) {
        if (metadata.hasVersion(range)) {
            return range;
        }
        String latest = metadata.getLatestVersion();
        if (latest != null && !latest.isBlank()) {
            return latest;
        }
        return VersionUtil.highest(metadata.getVersions().keySet()).orElse(null);
    }

    private CompletableFuture<PackageMetadata> fetchWithCache(String name) {
        PackageMetadata cached = cache.getMetadata(name);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }

        long timeoutMillis = config.getFetchTimeout().toMillis();
        return limiter.submit(() -> timedFetch(fetcher, name, timeoutMillis)).thenApply(metadata -> {
            if (metadata == null) {
                throw new CompletionException(new IllegalStateException("Registry returned no metadata for " + name));
            }
            cache.setMetadata(name, metadata);
            return metadata;
        });
    }

    /**
     * Fetch bounded by {@code timeoutMillis}; a call that fails or times out is cancelled.
     */
    static CompletableFuture<PackageMetadata> timedFetch(MetadataFetcher fetcher, String name, long timeoutMillis) {
        CompletableFuture<PackageMetadata> call;
        try {
            call = fetcher.fetch(name);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return call.copy()
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .whenComplete((metadata, error) -> {
                    if (error != null) {
                        call.cancel(true);
                    }
                });
    }

    private static boolean isCircular(String name, List<String> ancestors) {
        String prefix = name + "@";
        return ancestors.stream().anyMatch(entry -> entry.startsWith(prefix));
    }

    private void trackVersion(String name, String version) {
        packageVersions.computeIfAbsent(name, k -> ConcurrentHashMap.newKeySet()).add(version);
    }

    private static List<String> sortedVersions(Set<String> versions) {
        Set<String> sorted = new TreeSet<>(VersionUtil::compare);
        sorted.addAll(versions);
        return List.copyOf(sorted);
    }

    private ChildResolution skip(String name, SkipReason reason) {
        skipCounts.merge(reason, 1, Integer::sum);
        return ChildResolution.skipped(name, reason);
    }

    private static boolean isTimeout(Throwable error) {
        return rootCause(error) instanceof TimeoutException;
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
