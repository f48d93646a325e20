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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import simpeaks.configuration.ParameterStore;
import simpeaks.configuration.SimPeaksConfig;
import simpeaks.image.Frame;
import simpeaks.processing.FrameCompositor;
import simpeaks.processing.FrameSettings;
import simpeaks.processing.noise.NoiseGenerator;

import java.util.function.Consumer;

import static simpeaks.configuration.SimPeaksParameter.*;

/**
 * Simulated detector: a dedicated thread waits for a start request, then produces one frame per acquire period until the acquisition is stopped or complete.
 * Start and stop requests are made by writing 1 or 0 to {@link simpeaks.configuration.SimPeaksParameter#ACQUIRE}.
 * Frames are computed from the parameters read at the beginning of each cycle.
 */
public class AcquisitionController {
    public final static Logger logger = LoggerFactory.getLogger(AcquisitionController.class);
    public final static String STATUS_IDLE = "Simulation Idle";
    public final static String STATUS_ACQUIRING = "Acquiring";
    final SimPeaksConfig config;
    final ParameterStore store;
    final FramePool pool;
    final FrameSink sink;
    final Clock clock;
    final FrameCompositor compositor;
    final SignalEvent startEvent = new SignalEvent();
    final SignalEvent stopEvent = new SignalEvent();
    final Consumer<Number> acquireListener = this::acquireWritten;
    volatile boolean acquiring, shutdown;
    volatile int imagesCounter;
    volatile double elapsed;
    volatile String statusMessage = STATUS_IDLE;
    // only accessed by the acquisition thread
    boolean needsReset;
    long uniqueId;
    long startNanos;
    Frame frame;
    Thread thread;

    public AcquisitionController(SimPeaksConfig config, ParameterStore store, FramePool pool, FrameSink sink) {
        this(config, store, pool, sink, SystemClock.INSTANCE, new NoiseGenerator());
    }

    public AcquisitionController(SimPeaksConfig config, ParameterStore store, FramePool pool, FrameSink sink, Clock clock, NoiseGenerator noiseGenerator) {
        this.config = config;
        this.store = store;
        this.pool = pool;
        this.sink = sink;
        this.clock = clock;
        this.compositor = new FrameCompositor(noiseGenerator);
        store.addListener(ACQUIRE, acquireListener);
        logger.info("{}: created detector maxSize: {}x{} maxPeaks: {}", config.getPortName(), config.getMaxSizeX(), config.getMaxSizeY(), config.getMaxPeaks());
    }

    /**
     * Starts the acquisition thread
     * @return this controller
     * @throws IllegalStateException if the thread was already started or the controller is shut down
     */
    public synchronized AcquisitionController start() {
        if (shutdown) throw new IllegalStateException("Detector "+config.getPortName()+" is shut down");
        if (thread!=null) throw new IllegalStateException("Detector "+config.getPortName()+" is already started");
        thread = new Thread(this::run, "SimPeaksTask-"+config.getPortName());
        thread.setDaemon(true);
        thread.start();
        return this;
    }

    public SimPeaksConfig getConfig() {
        return config;
    }

    public ParameterStore getParameterStore() {
        return store;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public boolean isAcquiring() {
        return acquiring;
    }

    public AcquisitionState getState() {
        return new AcquisitionState(acquiring, ImageMode.fromOrdinal(store.getInt(IMAGE_MODE)), imagesCounter, elapsed);
    }

    void acquireWritten(Number value) {
        int v = value.intValue();
        if (v==1) {
            // status is written before waking up the thread, which writes it back when the acquisition completes.
            // the event is also signaled while acquiring: a stop may be pending and the most recent request wins
            store.setInt(STATUS, DetectorStatus.ACQUIRE.ordinal());
            startEvent.signal();
        } else if (v==0 && acquiring) requestStop();
    }

    void requestStop() {
        stopEvent.signal();
        ImageMode mode = ImageMode.fromOrdinal(store.getInt(IMAGE_MODE));
        store.setInt(STATUS, (mode==ImageMode.CONTINUOUS ? DetectorStatus.IDLE : DetectorStatus.ABORTED).ordinal());
    }

    void run() {
        logger.debug("{}: acquisition thread started", config.getPortName());
        try {
            while (!shutdown) {
                if (!acquiring) {
                    startEvent.await();
                    if (shutdown) break;
                    if (!store.getBoolean(ACQUIRE)) { // stopped before the thread woke up
                        store.setInt(STATUS, DetectorStatus.IDLE.ordinal());
                        continue;
                    }
                    beginAcquisition();
                }
                try {
                    acquireFrame();
                } catch (IllegalArgumentException e) {
                    logger.warn("{}: invalid configuration, frame skipped: {}", config.getPortName(), e.getMessage());
                } catch (RuntimeException e) {
                    logger.error(config.getPortName()+": error while generating frame", e);
                }
                if (!acquiring) continue;
                double period = store.getDouble(ACQUIRE_PERIOD);
                if (stopEvent.await((long)(Math.max(0, period) * 1e9))) {
                    endAcquisition();
                    startEvent.clear();
                    if (!shutdown && store.getBoolean(ACQUIRE)) beginAcquisition(); // start requested after the stop
                }
            }
        } catch (InterruptedException e) {
            if (!shutdown) logger.error(config.getPortName()+": acquisition thread interrupted", e);
        } finally {
            acquiring = false;
            if (frame!=null) {
                pool.release(frame);
                frame = null;
            }
            logger.debug("{}: acquisition thread stopped", config.getPortName());
        }
    }

    void beginAcquisition() {
        stopEvent.clear();
        imagesCounter = 0;
        elapsed = 0;
        needsReset = true;
        startNanos = clock.nanoTime();
        statusMessage = STATUS_ACQUIRING;
        store.setInt(STATUS, DetectorStatus.ACQUIRE.ordinal());
        store.setInt(NUM_IMAGES_COUNTER, 0);
        acquiring = true;
        // a stop stored before acquiring was set is not seen by the listener
        if (!store.getBoolean(ACQUIRE)) requestStop();
        logger.info("{}: starting acquisition", config.getPortName());
    }

    void endAcquisition() {
        statusMessage = STATUS_IDLE;
        acquiring = false;
        logger.info("{}: acquisition stopped after {} frames", config.getPortName(), imagesCounter);
    }

    void completeAcquisition() {
        statusMessage = STATUS_IDLE;
        acquiring = false;
        startEvent.clear();
        // acquiring is false: the listener does not interpret this write as a stop request
        store.setInt(ACQUIRE, 0);
        store.setInt(STATUS, DetectorStatus.IDLE.ordinal());
        logger.info("{}: acquisition complete after {} frames", config.getPortName(), imagesCounter);
    }

    void acquireFrame() {
        FrameSettings settings = FrameSettings.read(store, config.getMaxPeaks(), config.is1D());
        boolean integrate = store.getBoolean(INTEGRATE);
        if (store.getBoolean(RESET)) {
            needsReset = true;
            store.setInt(RESET, 0);
        }
        if (frame==null || !frame.sameProperties(settings.getSizeX(), settings.getSizeY(), settings.getDataType())) {
            if (frame!=null) {
                logger.debug("{}: frame geometry changed, reallocating", config.getPortName());
                pool.release(frame);
                frame = null;
            }
            frame = pool.allocate(settings.getSizeX(), settings.getSizeY(), settings.getDataType());
            if (frame==null) {
                logger.error("{}: failed to allocate frame {}x{} {}", config.getPortName(), settings.getSizeX(), settings.getSizeY(), settings.getDataType());
                return;
            }
            frame.setName(config.getPortName());
            needsReset = true;
        }
        compositor.compose(frame, settings, integrate, needsReset);
        needsReset = false;

        int arrayCounter = store.getInt(ARRAY_COUNTER) + 1;
        imagesCounter = imagesCounter + 1;
        double timeStamp = clock.wallClockSeconds();
        frame.setUniqueId(++uniqueId).setTimeStamp(timeStamp);
        elapsed = (clock.nanoTime() - startNanos) / 1e9;
        store.setInt(ARRAY_COUNTER, arrayCounter);
        store.setInt(NUM_IMAGES_COUNTER, imagesCounter);
        store.setDouble(TIMESTAMP, timeStamp);
        store.setDouble(ELAPSED_TIME, elapsed);
        logger.trace("{}: frame {} computed", config.getPortName(), uniqueId);

        if (store.getBoolean(ARRAY_CALLBACKS)) sink.publish(integrate ? pool.copy(frame) : frame, uniqueId, timeStamp);

        ImageMode mode = ImageMode.fromOrdinal(store.getInt(IMAGE_MODE));
        if (mode==ImageMode.SINGLE || (mode==ImageMode.MULTIPLE && imagesCounter >= store.getInt(NUM_IMAGES))) completeAcquisition();
    }

    /**
     * Stops the acquisition thread and releases the frame. The controller cannot be restarted
     */
    public void shutdown() {
        Thread t;
        synchronized (this) {
            if (shutdown) return;
            shutdown = true;
            t = thread;
        }
        store.removeListener(ACQUIRE.getKey(), acquireListener);
        startEvent.signal();
        stopEvent.signal();
        if (t!=null) {
            t.interrupt();
            try {
                t.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) logger.warn("{}: acquisition thread did not stop", config.getPortName());
        }
        acquiring = false;
        statusMessage = STATUS_IDLE;
        logger.info("{}: shut down", config.getPortName());
    }

    /**
     * Logs the configuration and state of the detector
     * @param details 0: port name only, otherwise configuration, frame geometry and counters
     */
    public void report(int details) {
        logger.info("{}: {}", config.getPortName(), statusMessage);
        if (details > 0) {
            logger.info("  maxSize: {}x{} ({})", config.getMaxSizeX(), config.getMaxSizeY(), config.is1D() ? "1D" : "2D");
            logger.info("  maxPeaks: {}", config.getMaxPeaks());
            logger.info("  state: {}", getState());
            logger.info("  size: {}x{} data type: {}", store.getInt(SIZE_X), store.getInt(SIZE_Y), store.getInt(DATA_TYPE));
            logger.info("  arrayCounter: {} imagesCounter: {} lastUniqueId: {}", store.getInt(ARRAY_COUNTER), imagesCounter, uniqueId);
        }
    }
}
