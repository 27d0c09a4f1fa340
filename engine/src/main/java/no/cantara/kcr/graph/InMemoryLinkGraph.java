package no.cantara.kcr.graph;

import no.cantara.kcr.concurrent.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Adjacency-set link graph held in process memory.
 *
 * <p>Edges live in two indexes, outgoing and incoming, keyed by path. Every vertex
 * has an entry in both. One {@link ReadWriteLock} guards the whole structure:
 * queries share the read lock, mutations hold the write lock for their full
 * duration so no reader sees a half-replaced edge set.
 */
public class InMemoryLinkGraph implements LinkGraph {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryLinkGraph.class);

    private final Map<String, Set<String>> out = new LinkedHashMap<>();
    private final Map<String, Set<String>> in = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // ── Mutation ──────────────────────────────────────────────────────────────────

    @Override
    public void addVertex(String path) {
        Objects.requireNonNull(path, "path");
        lock.writeLock().lock();
        try {
            ensureVertex(path);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void removeVertex(String path) {
        lock.writeLock().lock();
        try {
            Set<String> targets = out.remove(path);
            Set<String> sources = in.remove(path);
            if (targets != null) {
                targets.forEach(t -> in.get(t).remove(path));
            }
            if (sources != null) {
                sources.forEach(s -> out.get(s).remove(path));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean removeOrOrphanVertex(String path) {
        lock.writeLock().lock();
        try {
            Set<String> targets = out.get(path);
            if (targets == null) return false;
            targets.forEach(t -> in.get(t).remove(path));
            targets.clear();
            if (!in.get(path).isEmpty()) return false;
            out.remove(path);
            in.remove(path);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Set<String> replaceOutgoingEdges(String path, Collection<String> targets) {
        Objects.requireNonNull(path, "path");
        Set<String> wanted = new LinkedHashSet<>(targets);
        wanted.remove(null);
        if (wanted.remove(path)) {
            logger.debug("Ignoring self-link on '{}'", path);
        }

        lock.writeLock().lock();
        try {
            ensureVertex(path);
            Set<String> current = out.get(path);
            for (String old : current) {
                in.get(old).remove(path);
            }
            current.clear();
            for (String target : wanted) {
                ensureVertex(target);
                current.add(target);
                in.get(target).add(path);
            }

            Set<String> cycleClosing = new LinkedHashSet<>();
            for (String target : wanted) {
                if (reachable(target, path)) {
                    cycleClosing.add(target);
                }
            }
            if (!cycleClosing.isEmpty()) {
                logger.warn("Links from '{}' to {} form a cycle; keeping them", path, cycleClosing);
            }
            return cycleClosing;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void rebuild(Map<String, ? extends Collection<String>> outgoingByPath) {
        lock.writeLock().lock();
        try {
            out.clear();
            in.clear();
            outgoingByPath.keySet().stream().sorted().forEach(source -> {
                ensureVertex(source);
                Collection<String> targets = outgoingByPath.get(source);
                if (targets == null) return;
                for (String target : targets) {
                    if (target == null || target.equals(source)) continue;
                    ensureVertex(target);
                    out.get(source).add(target);
                    in.get(target).add(source);
                }
            });
            logger.info("Link graph rebuilt: {} vertices, {} edges", out.size(), countEdges());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void ensureVertex(String path) {
        out.computeIfAbsent(path, k -> new LinkedHashSet<>());
        in.computeIfAbsent(path, k -> new LinkedHashSet<>());
    }

    // ── Queries ───────────────────────────────────────────────────────────────────

    @Override
    public boolean wouldCreateCycle(String source, String target) {
        if (Objects.equals(source, target)) return true;
        lock.readLock().lock();
        try {
            return reachable(target, source);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** BFS over outgoing edges; caller holds a lock. */
    private boolean reachable(String from, String to) {
        if (!out.containsKey(from)) return false;
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        seen.add(from);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            if (node.equals(to)) return true;
            for (String next : out.getOrDefault(node, Set.of())) {
                if (seen.add(next)) queue.add(next);
            }
        }
        return false;
    }

    @Override
    public List<TraversalHit> traverse(Collection<String> startPaths, int maxDepth, int maxCount,
                                       CancellationSignal cancellation) {
        if (maxDepth <= 0 || maxCount <= 0 || startPaths.isEmpty()) return List.of();

        Set<String> visited = new HashSet<>(startPaths);
        List<String> frontier = new ArrayList<>(new LinkedHashSet<>(startPaths));
        List<TraversalHit> hits = new ArrayList<>();

        lock.readLock().lock();
        try {
            for (int level = 1; level <= maxDepth && !frontier.isEmpty(); level++) {
                cancellation.throwIfCancelled();
                List<String> next = new ArrayList<>();
                for (String node : frontier) {
                    for (String target : out.getOrDefault(node, Set.of())) {
                        if (!visited.add(target)) continue;
                        hits.add(new TraversalHit(target, level, node));
                        if (hits.size() >= maxCount) {
                            return List.copyOf(hits);
                        }
                        next.add(target);
                    }
                }
                logger.debug("Traversal level {}: {} new vertices", level, next.size());
                frontier = next;
            }
            return List.copyOf(hits);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean containsVertex(String path) {
        lock.readLock().lock();
        try {
            return out.containsKey(path);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> outgoing(String path) {
        lock.readLock().lock();
        try {
            return Set.copyOf(out.getOrDefault(path, Set.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> incoming(String path) {
        lock.readLock().lock();
        try {
            return Set.copyOf(in.getOrDefault(path, Set.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Iterative Tarjan SCC. Components come back sorted internally and ordered by
     * their first path, so repeated calls on the same graph give the same list.
     */
    @Override
    public List<List<String>> enumerateCycles() {
        lock.readLock().lock();
        try {
            Map<String, Integer> index = new HashMap<>();
            Map<String, Integer> low = new HashMap<>();
            Deque<String> stack = new ArrayDeque<>();
            Set<String> onStack = new HashSet<>();
            List<List<String>> cycles = new ArrayList<>();
            int counter = 0;

            for (String root : out.keySet()) {
                if (index.containsKey(root)) continue;

                Deque<Map.Entry<String, Iterator<String>>> work = new ArrayDeque<>();
                index.put(root, counter);
                low.put(root, counter);
                counter++;
                stack.push(root);
                onStack.add(root);
                work.push(Map.entry(root, out.get(root).iterator()));

                while (!work.isEmpty()) {
                    String node = work.peek().getKey();
                    Iterator<String> it = work.peek().getValue();
                    if (it.hasNext()) {
                        String next = it.next();
                        if (!index.containsKey(next)) {
                            index.put(next, counter);
                            low.put(next, counter);
                            counter++;
                            stack.push(next);
                            onStack.add(next);
                            work.push(Map.entry(next, out.get(next).iterator()));
                        } else if (onStack.contains(next)) {
                            low.put(node, Math.min(low.get(node), index.get(next)));
                        }
                        continue;
                    }
                    work.pop();
                    if (!work.isEmpty()) {
                        String parent = work.peek().getKey();
                        low.put(parent, Math.min(low.get(parent), low.get(node)));
                    }
                    if (low.get(node).equals(index.get(node))) {
                        List<String> component = new ArrayList<>();
                        String member;
                        do {
                            member = stack.pop();
                            onStack.remove(member);
                            component.add(member);
                        } while (!member.equals(node));
                        if (component.size() > 1) {
                            Collections.sort(component);
                            cycles.add(List.copyOf(component));
                        }
                    }
                }
            }
            cycles.sort((a, b) -> a.get(0).compareTo(b.get(0)));
            return List.copyOf(cycles);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isAcyclic() {
        return enumerateCycles().isEmpty();
    }

    @Override
    public int vertexCount() {
        lock.readLock().lock();
        try {
            return out.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int edgeCount() {
        lock.readLock().lock();
        try {
            return countEdges();
        } finally {
            lock.readLock().unlock();
        }
    }

    private int countEdges() {
        return out.values().stream().mapToInt(Set::size).sum();
    }

    @Override
    public Set<String> vertices() {
        lock.readLock().lock();
        try {
            return Set.copyOf(out.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }
}
