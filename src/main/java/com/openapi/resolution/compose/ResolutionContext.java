package com.openapi.resolution.compose;

import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.exception.CircularReferenceException;
import com.openapi.resolution.exception.RecursionLimitExceededException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Per-resolution state threaded through every recursive composer call: the stack of
 * {@code $ref} pointers currently being resolved, the schema path used in error
 * messages and the nesting depth.
 *
 * <p>A context belongs to one resolution on one thread and is not thread-safe.</p>
 */
public class ResolutionContext {

    public static final int DEFAULT_MAX_DEPTH = 100;

    private final List<String> visited = new ArrayList<>();
    private final Deque<String> paths = new ArrayDeque<>();
    private final int maxDepth;

    public ResolutionContext() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ResolutionContext(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Creates a context rooted at the given schema path.
     */
    public static ResolutionContext at(String rootPath, int maxDepth) {
        ResolutionContext ctx = new ResolutionContext(maxDepth);
        ctx.paths.push(rootPath);
        return ctx;
    }

    /**
     * Pushes a pointer onto the visited stack.
     *
     * @throws CircularReferenceException if the pointer is already being resolved
     */
    public void enter(String pointer) {
        checkNotVisited(pointer);
        visited.add(pointer);
    }

    public void exit(String pointer) {
        int last = visited.size() - 1;
        if (last < 0 || !visited.get(last).equals(pointer)) {
            throw new IllegalStateException("Unbalanced exit for " + pointer + ", stack is " + visited);
        }
        visited.remove(last);
    }

    public boolean isVisited(String pointer) {
        return visited.contains(pointer);
    }

    public void checkNotVisited(String pointer) {
        int index = visited.indexOf(pointer);
        if (index >= 0) {
            List<String> chain = new ArrayList<>(visited.subList(index, visited.size()));
            chain.add(pointer);
            throw new CircularReferenceException(chain, currentPath());
        }
    }

    /**
     * Returns the pointers on the current resolution path, outermost first.
     */
    public List<String> visitedPointers() {
        return List.copyOf(visited);
    }

    /**
     * Descends into a nested schema at {@code path}.
     *
     * @throws RecursionLimitExceededException when the nesting exceeds the maximum depth
     */
    public void descend(String path) {
        if (paths.size() >= maxDepth) {
            throw new RecursionLimitExceededException(maxDepth, path);
        }
        paths.push(path);
    }

    public void ascend() {
        if (paths.isEmpty()) {
            throw new IllegalStateException("ascend() without matching descend()");
        }
        paths.pop();
    }

    /**
     * Path of the child {@code segments} below the current schema path.
     */
    public String childPath(String... segments) {
        StringBuilder sb = new StringBuilder(currentPath());
        for (String segment : segments) {
            sb.append('/').append(SchemaReference.escape(segment));
        }
        return sb.toString();
    }

    public String currentPath() {
        String path = paths.peek();
        return path != null ? path : "#";
    }

    public int depth() {
        return paths.size();
    }

    public int maxDepth() {
        return maxDepth;
    }
}
