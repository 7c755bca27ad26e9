package com.convsync.gateway.session;

import com.convsync.domain.StreamEntryId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class CursorCellTest {

    @Test
    void advance_ShouldIgnoreOlderOrEqualIds() {
        CursorCell cell = new CursorCell(StreamEntryId.of(10, 0));

        assertFalse(cell.advance(StreamEntryId.of(9, 9)));
        assertFalse(cell.advance(StreamEntryId.of(10, 0)));
        assertFalse(cell.advance(null));
        assertTrue(cell.advance(StreamEntryId.of(10, 1)));
        assertEquals(StreamEntryId.of(10, 1), cell.get());
    }

    @Test
    void nullInitialShouldMeanBeginning() {
        assertEquals(StreamEntryId.BEGINNING, new CursorCell(null).get());
    }

    @Test
    void concurrentAdvancesShouldKeepMaximum() throws Exception {
        CursorCell cell = new CursorCell(StreamEntryId.BEGINNING);
        CountDownLatch go = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int offset = t;
            Thread th = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 1000; i++) {
                    cell.advance(StreamEntryId.of(1 + i * 4L + offset, 0));
                }
            });
            threads.add(th);
            th.start();
        }
        go.countDown();
        for (Thread th : threads) {
            th.join();
        }
        assertEquals(StreamEntryId.of(1 + 999 * 4L + 3, 0), cell.get());
    }
}
