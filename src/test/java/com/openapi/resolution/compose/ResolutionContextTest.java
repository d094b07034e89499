package com.openapi.resolution.compose;

import com.openapi.resolution.exception.CircularReferenceException;
import com.openapi.resolution.exception.RecursionLimitExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResolutionContext Tests")
class ResolutionContextTest {

    @Test
    @DisplayName("Paths nest and unwind")
    void paths() {
        ResolutionContext ctx = ResolutionContext.at("#/components/schemas/User", 10);

        ctx.descend(ctx.childPath("properties", "home/address"));

        assertEquals("#/components/schemas/User/properties/home~1address", ctx.currentPath());
        assertEquals(2, ctx.depth());
        ctx.ascend();
        assertEquals("#/components/schemas/User", ctx.currentPath());
    }

    @Test
    @DisplayName("An empty context reports the document root")
    void rootPath() {
        assertEquals("#", new ResolutionContext().currentPath());
    }

    @Test
    @DisplayName("Entering a visited pointer reports the chain")
    void cycle() {
        ResolutionContext ctx = new ResolutionContext();
        ctx.enter("#/a");
        ctx.enter("#/b");

        CircularReferenceException e = assertThrows(CircularReferenceException.class, () -> ctx.enter("#/a"));

        assertEquals(List.of("#/a", "#/b", "#/a"), e.getPointerChain());
        assertEquals(List.of("#/a", "#/b"), ctx.visitedPointers());
    }

    @Test
    @DisplayName("Exits must match the last entry")
    void unbalancedExit() {
        ResolutionContext ctx = new ResolutionContext();
        ctx.enter("#/a");

        assertThrows(IllegalStateException.class, () -> ctx.exit("#/b"));
        ctx.exit("#/a");
        assertFalse(ctx.isVisited("#/a"));
    }

    @Test
    @DisplayName("Descending past the limit fails")
    void depthLimit() {
        ResolutionContext ctx = new ResolutionContext(2);
        ctx.descend("#/a");
        ctx.descend("#/a/b");

        RecursionLimitExceededException e = assertThrows(RecursionLimitExceededException.class,
                () -> ctx.descend("#/a/b/c"));

        assertEquals("#/a/b/c", e.getSchemaPath());
        assertThrows(IllegalArgumentException.class, () -> new ResolutionContext(0));
    }
}
