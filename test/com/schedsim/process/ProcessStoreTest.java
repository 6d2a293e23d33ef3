package com.schedsim.process;

import static org.junit.jupiter.api.Assertions.*;

import com.schedsim.exception.DuplicateProcessIdException;
import com.schedsim.exception.InvalidArrivalTimeException;
import com.schedsim.exception.InvalidBurstTimeException;
import com.schedsim.exception.SimulationSetupException;
import com.schedsim.exception.TickOverflowException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for process registration and ordering
 */
public class ProcessStoreTest {

    private ProcessStore store;

    @BeforeEach
    void setUp() {
        store = new ProcessStore();
    }

    @Test
    void testAllIsOrderedByArrivalThenId() {
        store.register(new ProcessDescriptor(7, 3, 1, 0));
        store.register(new ProcessDescriptor(2, 0, 4, 0));
        store.register(new ProcessDescriptor(5, 3, 2, 0));
        store.register(new ProcessDescriptor(1, 3, 2, 0));

        List<ProcessDescriptor> all = store.all();
        assertEquals(4, all.size());
        assertEquals(2, all.get(0).getId());
        assertEquals(1, all.get(1).getId());
        assertEquals(5, all.get(2).getId());
        assertEquals(7, all.get(3).getId());
    }

    @Test
    void testDuplicateIdIsRejected() {
        store.register(ProcessDescriptor.of(1, 0, 3));
        DuplicateProcessIdException e = assertThrows(DuplicateProcessIdException.class,
                () -> store.register(ProcessDescriptor.of(1, 4, 2)));
        assertEquals(1, e.getProcessId());
        assertEquals(1, store.size());
    }

    @Test
    void testNonPositiveBurstIsRejected() {
        assertThrows(InvalidBurstTimeException.class, () -> store.register(ProcessDescriptor.of(1, 0, 0)));
        assertThrows(InvalidBurstTimeException.class, () -> store.register(ProcessDescriptor.of(2, 0, -3)));
        assertEquals(0, store.size());
    }

    @Test
    void testNegativeArrivalIsRejected() {
        assertThrows(InvalidArrivalTimeException.class, () -> store.register(ProcessDescriptor.of(1, -1, 2)));
    }

    @Test
    void testSetupErrorsAreIllegalArguments() {
        SimulationSetupException e = assertThrows(SimulationSetupException.class,
                () -> new ProcessStore(List.of(ProcessDescriptor.of(1, 0, 1), ProcessDescriptor.of(1, 0, 1))));
        assertTrue(e instanceof IllegalArgumentException);
    }

    @Test
    void testRegistrationClosed() {
        store.register(ProcessDescriptor.of(1, 0, 3));
        store.close();
        assertTrue(store.isClosed());
        assertThrows(IllegalStateException.class, () -> store.register(ProcessDescriptor.of(2, 0, 3)));
    }

    @Test
    void testCreateRuntimesStartsFresh() {
        store.register(ProcessDescriptor.of(2, 1, 4));
        store.register(ProcessDescriptor.of(1, 0, 3));

        List<ProcessRuntime> runtimes = store.createRuntimes();
        assertEquals(2, runtimes.size());
        assertEquals(1, runtimes.get(0).getId());
        for (ProcessRuntime p : runtimes) {
            assertEquals(ProcessState.NEW, p.getState());
            assertEquals(p.getBurstTime(), p.getRemainingTime());
            assertEquals(ProcessRuntime.UNSET, p.getFirstRunTime());
            assertEquals(ProcessRuntime.UNSET, p.getCompletionTime());
        }
        assertNotSame(runtimes.get(0), store.createRuntimes().get(0));
    }

    @Test
    void testTotals() {
        assertEquals(0, store.getTotalBurstTime());
        assertEquals(0, store.getMaxArrivalTime());
        store.register(ProcessDescriptor.of(1, 0, 3));
        store.register(ProcessDescriptor.of(2, 6, 4));
        assertEquals(7, store.getTotalBurstTime());
        assertEquals(6, store.getMaxArrivalTime());
    }

    @Test
    void testLargeBurstWithinTickRangeIsAccepted() {
        store.register(ProcessDescriptor.of(1, 1, Integer.MAX_VALUE - 1));
        assertEquals(Integer.MAX_VALUE - 1L, store.getTotalBurstTime());
        assertEquals(Integer.MAX_VALUE, store.getTotalBurstTime() + store.getMaxArrivalTime());
    }

    @Test
    void testBurstPlusArrivalBeyondTickRangeIsRejected() {
        ProcessDescriptor late = ProcessDescriptor.of(1, 2, Integer.MAX_VALUE - 1);
        assertThrows(TickOverflowException.class, () -> store.register(late));
        assertEquals(0, store.size());
    }

    @Test
    void testBurstSumBeyondTickRangeIsRejected() {
        store.register(ProcessDescriptor.of(1, 0, Integer.MAX_VALUE / 2 + 1));
        SimulationSetupException e = assertThrows(SimulationSetupException.class,
                () -> store.register(ProcessDescriptor.of(2, 0, Integer.MAX_VALUE / 2 + 1)));
        assertTrue(e instanceof TickOverflowException);
        assertEquals(Integer.MAX_VALUE / 2 + 1, store.getTotalBurstTime());
        assertEquals(1, store.size());
    }
}
