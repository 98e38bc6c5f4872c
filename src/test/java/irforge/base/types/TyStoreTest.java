package irforge.base.types;

import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class TyStoreTest {
    private TyStore store;

    @BeforeEach
    public void setUp() {
        Logging.init();
        store = new TyStore();
    }

    @Test
    public void testStructuralIdentity() {
        var u32 = store.integer(IntegerTy.U32);
        var ref1 = store.ref(Region.STATIC, store.tuple(List.of(u32, store.bool())), RefKind.SHARED);
        var ref2 = store.ref(Region.STATIC, store.tuple(List.of(store.integer(IntegerTy.U32), store.bool())),
                RefKind.SHARED);
        assert ref1 == ref2;
        assert ref1.equals(ref2);

        var mutRef = store.ref(Region.STATIC, store.tuple(List.of(u32, store.bool())), RefKind.MUT);
        assert ref1 != mutRef;
        assert !ref1.equals(mutRef);
    }

    @Test
    public void testBoundRegionsAreStructural() {
        var a = store.ref(Region.bound(0, 1), store.unit(), RefKind.SHARED);
        var b = store.ref(Region.bound(0, 1), store.unit(), RefKind.SHARED);
        var c = store.ref(Region.bound(1, 1), store.unit(), RefKind.SHARED);
        assertSame(a, b);
        assertNotSame(a, c);
    }

    @Test
    public void testConcurrentInterning() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<Ty> published = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        var inner = store.tuple(List.of(store.typeVar(i % 10), store.integer(IntegerTy.I64)));
                        published.add(store.ref(Region.ERASED, inner, RefKind.MUT));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            executor.shutdown();
        }
        // Ty uses identity equality, so one handle per shape means exactly ten distinct handles
        assertEquals(10, published.size());
    }
}
