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
package simpeaks.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.json.simple.JSONObject;
import org.slf4j.LoggerFactory;
import simpeaks.configuration.ParameterLibrary;
import simpeaks.configuration.SimPeaksConfig;
import simpeaks.configuration.SimPeaksParameter;
import simpeaks.core.AcquisitionController;
import simpeaks.core.DefaultFramePool;
import simpeaks.core.SimPeaksException;
import simpeaks.utils.JSONUtils;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs a simulated detector without client: reads a setup file {"config": {...}, "parameters": {...}, "frames": n}, acquires n frames (or until the acquisition completes) and logs each frame.
 * An optional second argument is the path of a file where the setup is saved after the run
 */
public class RunSimulation {
    public final static org.slf4j.Logger logger = LoggerFactory.getLogger(RunSimulation.class);

    public static void main(String[] args) {
        Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.INFO);
        if (args.length==0) {
            logger.error("Missing argument: setup file and optionally an output setup file as second argument");
            return;
        } else if (args.length>2) {
            logger.error("Too many arguments. Expect only path of setup file and optionally an output setup file as second argument");
            return;
        }
        JSONObject setup;
        try {
            setup = JSONUtils.readJSONObject(Paths.get(args[0]));
        } catch (IOException e) {
            logger.error("Could not read setup file: "+args[0], e);
            return;
        } catch (SimPeaksException e) {
            logger.error(e.getMessage());
            return;
        }
        try {
            run(setup, args.length==2 ? args[1] : null);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid setup: {}", e.getMessage());
        } catch (InterruptedException e) {
            logger.error("Interrupted", e);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return number of frames logged
     */
    static long run(JSONObject setup, String outputFile) throws InterruptedException {
        SimPeaksConfig config = new SimPeaksConfig();
        if (setup.containsKey("config")) config.initFromJSONEntry(setup.get("config"));
        ParameterLibrary parameters = new ParameterLibrary(config);
        if (setup.containsKey("parameters")) parameters.initFromJSONEntry(setup.get("parameters"));
        int frames = JSONUtils.getInt(setup, "frames", 10);
        if (frames<1) throw new IllegalArgumentException("frames must be at least 1: "+frames);
        logger.info("Configuration: {}", config);
        logger.debug("Parameters:\n{}", parameters);

        DefaultFramePool pool = new DefaultFramePool(config.getMaxBuffers(), config.getMaxMemory());
        CountDownLatch remaining = new CountDownLatch(frames);
        AcquisitionController controller = new AcquisitionController(config, parameters, pool, (frame, uniqueId, timeStamp) -> {
            if (remaining.getCount()==0) return;
            double[] minAndMax = frame.getMinAndMax();
            logger.info("Frame #{} ({}x{} {}) min: {} max: {}", uniqueId, frame.sizeX(), frame.sizeY(), frame.getDataType(), minAndMax[0], minAndMax[1]);
            remaining.countDown();
        }).start();
        long start = System.currentTimeMillis();
        parameters.setInt(SimPeaksParameter.ACQUIRE, 1);
        while (!remaining.await(100, TimeUnit.MILLISECONDS)) {
            if (parameters.getInt(SimPeaksParameter.ACQUIRE)==0 && !controller.isAcquiring()) break; // acquisition complete
        }
        if (parameters.getInt(SimPeaksParameter.ACQUIRE)!=0) parameters.setInt(SimPeaksParameter.ACQUIRE, 0);
        long produced = frames - remaining.getCount();
        logger.info("{} frames in {}ms", produced, System.currentTimeMillis() - start);
        controller.report(1);
        controller.shutdown();
        if (outputFile!=null) {
            JSONObject res = new JSONObject();
            res.put("config", config.toJSONEntry());
            res.put("parameters", parameters.toJSONEntry());
            res.put("frames", frames);
            try {
                JSONUtils.writeJSONObject(Paths.get(outputFile), res);
                logger.info("Setup saved to: {}", outputFile);
            } catch (IOException e) {
                logger.error("Could not write setup file: "+outputFile, e);
            }
        }
        return produced;
    }
}
