/* 
 * Copyright (C) 2022 SimPeaks developers
 *
 * This File is part of SimPeaks
 *
 * SimPeaks is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SimPeaks is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SimPeaks.  If not, see <http://www.gnu.org/licenses/>.
 */
package simpeaks.core;

import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class SignalEventTest {
    @Test
    public void testSignalBeforeWait() throws InterruptedException {
        SignalEvent e = new SignalEvent();
        e.signal();
        e.signal();
        assertTrue("signaled", e.await(10, TimeUnit.MILLISECONDS));
        assertFalse("signals are not queued", e.await(10, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testClear() throws InterruptedException {
        SignalEvent e = new SignalEvent();
        e.signal();
        e.clear();
        assertFalse("cleared", e.await(0));
    }

    @Test
    public void testWakeUp() throws InterruptedException {
        SignalEvent e = new SignalEvent();
        CountDownLatch done = new CountDownLatch(1);
        Thread t = new Thread(() -> {
            try {
                e.await();
                done.countDown();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        t.start();
        Thread.sleep(20);
        assertEquals("waiting", 1, done.getCount());
        e.signal();
        assertTrue("woken up", done.await(2, TimeUnit.SECONDS));
        assertFalse("consumed", e.await(0));
    }

    @Test
    public void testTimeout() throws InterruptedException {
        SignalEvent e = new SignalEvent();
        long t0 = System.nanoTime();
        assertFalse("timeout", e.await(50, TimeUnit.MILLISECONDS));
        assertTrue("waited", System.nanoTime() - t0 >= TimeUnit.MILLISECONDS.toNanos(45));
    }
}
