package com.treesync.engine;

import com.treesync.api.Observer;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ObservableTest {

    private ManualExecutor ui;
    private NotificationScheduler scheduler;
    private List<String> calls;

    @Before
    public void setUp() {
        ui = new ManualExecutor();
        scheduler = new NotificationScheduler(ui);
        calls = new ArrayList<>();
    }

    @Test
    public void testNotifyIsDeferred() {
        Observable<String> obs = new Observable<>(scheduler, "src");
        obs.addObserver(s -> calls.add("a:" + s));

        obs.notifyObservers();

        assertTrue("No synchronous invocation", calls.isEmpty());
        assertEquals(1, ui.queued());

        ui.runAll();
        assertEquals(List.of("a:src"), calls);
    }

    @Test
    public void testDuplicateRegistrationStoredOnce() {
        Observable<String> obs = new Observable<>(scheduler, "src");
        Observer<String> o = s -> calls.add("o");
        obs.addObserver(o);
        obs.addObserver(o);

        assertEquals(1, obs.observerCount());
        obs.notifyObservers();
        ui.runAll();
        assertEquals(1, calls.size());
    }

    @Test
    public void testNotifyWithoutObserversSchedulesNothing() {
        Observable<String> obs = new Observable<>(scheduler, "src");
        obs.notifyObservers();

        assertEquals(0, ui.queued());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    public void testRemoveAbsentObserverIsNoOp() {
        Observable<String> obs = new Observable<>(scheduler, "src");
        obs.removeObserver(s -> calls.add("never"));
        obs.removeObserver(null);
        assertEquals(0, obs.observerCount());
    }

    @Test
    public void testRepeatedNotifyCoalesces() {
        Observable<String> obs = new Observable<>(scheduler, "src");
        obs.addObserver(s -> calls.add("a"));

        for (int i = 0; i < 10; i++)
            obs.notifyObservers();

        assertEquals("Only one drain requested", 1, ui.queued());
        ui.runAll();
        assertEquals(List.of("a"), calls);
    }

    @Test
    public void testSameObserverOnTwoSourcesRunsOncePerDrain() {
        Observable<String> first = new Observable<>(scheduler, "first");
        Observable<String> second = new Observable<>(scheduler, "second");
        Observer<String> shared = calls::add;
        first.addObserver(shared);
        second.addObserver(shared);

        first.notifyObservers();
        second.notifyObservers();
        first.notifyObservers();
        ui.runAll();

        assertEquals(List.of("first"), calls);
    }

    @Test
    public void testObserverSharedByTwoValuesRunsOnce() {
        ObservableValue<Integer> a = new ObservableValue<>(scheduler, 0);
        ObservableValue<Integer> b = new ObservableValue<>(scheduler, 0);
        List<ObservableValue<Integer>> seen = new ArrayList<>();
        Observer<ObservableValue<Integer>> shared = seen::add;
        a.addObserver(shared);
        b.addObserver(shared);

        a.set(1);
        b.set(1);
        ui.runAll();

        assertEquals(1, seen.size());
        assertSame(a, seen.get(0));
    }

    @Test
    public void testRemovingFromOneSourceKeepsOtherRequest() {
        Observable<String> first = new Observable<>(scheduler, "first");
        Observable<String> second = new Observable<>(scheduler, "second");
        Observer<String> shared = calls::add;
        first.addObserver(shared);
        second.addObserver(shared);

        first.notifyObservers();
        second.notifyObservers();
        first.removeObserver(shared);
        ui.runAll();

        assertEquals(List.of("second"), calls);
    }

    @Test
    public void testObserversBoundToTheirSourceRunSeparately() {
        Observable<String> first = new Observable<>(scheduler, "first");
        Observable<String> second = new Observable<>(scheduler, "second");
        first.addObserver(s -> calls.add("first"));
        second.addObserver(s -> calls.add("second"));

        first.notifyObservers();
        second.notifyObservers();
        ui.runAll();

        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    public void testRemoveCancelsPendingNotification() {
        Observable<String> obs = new Observable<>(scheduler, "src");
        Observer<String> kept = s -> calls.add("kept");
        Observer<String> removed = s -> calls.add("removed");
        obs.addObserver(kept);
        obs.addObserver(removed);

        obs.notifyObservers();
        obs.removeObserver(removed);
        ui.runAll();

        assertEquals(List.of("kept"), calls);
        assertFalse(obs.hasObserver(removed));
    }
}
