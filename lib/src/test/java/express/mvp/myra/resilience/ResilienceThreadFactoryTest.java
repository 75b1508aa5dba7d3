package express.mvp.myra.resilience;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.*;

/** Tests for {@link ResilienceThreadFactory}. */
@SuppressFBWarnings(
        value = {"THROWS_METHOD_THROWS_CLAUSE_BASIC_EXCEPTION"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class ResilienceThreadFactoryTest {

    @Test
    @DisplayName("Create factory with name prefix")
    void createWithNamePrefix() {
        ResilienceThreadFactory factory = new ResilienceThreadFactory("retry");
        assertEquals("retry", factory.getNamePrefix());
        assertTrue(factory.isDaemon());
        assertEquals(0, factory.getThreadCount());
    }

    @Test
    @DisplayName("Daemon flag is applied to created threads")
    void daemonFlag() {
        assertFalse(new ResilienceThreadFactory("t", false).newThread(() -> {}).isDaemon());
        assertTrue(new ResilienceThreadFactory("t", true).newThread(() -> {}).isDaemon());
    }

    @Test
    @DisplayName("Thread names increment and threads are not started")
    void threadNamesIncrement() throws Exception {
        ResilienceThreadFactory factory = new ResilienceThreadFactory("worker");
        CountDownLatch latch = new CountDownLatch(1);

        Thread t1 = factory.newThread(latch::countDown);
        Thread t2 = factory.newThread(() -> {});

        assertEquals("worker-1", t1.getName());
        assertEquals("worker-2", t2.getName());
        assertEquals(2, factory.getThreadCount());
        assertFalse(t1.isAlive());

        t1.start();
        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
}
