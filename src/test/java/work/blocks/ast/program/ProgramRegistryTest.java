package work.blocks.ast.program;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import work.blocks.ast.node.SyntaxElement;

class ProgramRegistryTest {
    @Test
    void sharedRegistryIsASingleton() {
        var first = ProgramRegistry.shared();
        var second = ProgramRegistry.shared();

        assertSame(first, second);
        assertSame(first, ProgramRegistry.current().orElseThrow());
    }

    @Test
    void stacksAreLiveAcrossReferences() {
        var stack = List.of(SyntaxElement.create("start", Map.of("instruction", "start", "childStack", List.of())));
        var before = ProgramRegistry.shared().startStacks().size();

        ProgramRegistry.shared().startStacks().add(stack);

        var later = ProgramRegistry.shared().startStacks();
        assertEquals(before + 1, later.size());
        assertSame(stack, later.get(later.size() - 1));
        later.remove(stack);
    }

    @Test
    void independentRegistriesDoNotShareStacks() {
        var mine = new ProgramRegistry();
        var other = new ProgramRegistry();

        mine.actionStacks().add(List.of());

        assertNotSame(mine, ProgramRegistry.shared());
        assertEquals(1, mine.actionStacks().size());
        assertTrue(other.actionStacks().isEmpty());
        assertTrue(mine.startStacks().isEmpty());
    }

    @Test
    void concurrentAppendsAreNotLost() throws Exception {
        var registry = new ProgramRegistry();
        int writers = 8;
        int perWriter = 250;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        var ready = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<?>>();
            for (int w = 0; w < writers; w++) {
                futures.add(pool.submit(() -> {
                    ready.await();
                    for (int i = 0; i < perWriter; i++) {
                        registry.actionStacks().add(List.of());
                    }
                    return null;
                }));
            }
            ready.countDown();
            for (var future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(writers * perWriter, registry.actionStacks().size());
    }
}
