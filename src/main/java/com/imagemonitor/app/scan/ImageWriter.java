package com.imagemonitor.app.scan;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.imagemonitor.app.database.Database.ImageRecord;
import com.imagemonitor.app.database.PersistenceGateway;

/**
 * Thread única que grava imagens via {@link PersistenceGateway#streamInsertImages}.
 * Fila limitada dá backpressure ao produtor; um erro do worker volta para o produtor
 * na próxima chamada de {@link #add} ou {@link #finish}.
 */
final class ImageWriter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ImageWriter.class);

    private static final ImageRecord POISON =
            new ImageRecord("", "", "", "", 0, 0, 0, "", false, null, null, 0, 0, 0);

    private final PersistenceGateway gateway;
    private final BlockingQueue<ImageRecord> queue;
    private final AtomicReference<Throwable> workerError = new AtomicReference<>();
    private final Thread worker;
    private volatile int inserted;
    private boolean finished;

    ImageWriter(PersistenceGateway gateway, int capacity) {
        this.gateway = gateway;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.worker = new Thread(this::run, "image-writer");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    void add(ImageRecord record) {
        try {
            while (!queue.offer(record, 100, TimeUnit.MILLISECONDS)) {
                checkWorker();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while queueing image " + record.filePath(), e);
        }
        checkWorker();
    }

    /** Drains the queue, stops the worker and returns how many rows were inserted. */
    int finish() {
        if (!finished) {
            finished = true;
            stopWorker();
        }
        checkWorker();
        return inserted;
    }

    @Override
    public void close() {
        if (!finished) {
            finished = true;
            stopWorker();
        }
    }

    private void stopWorker() {
        try {
            while (worker.isAlive() && !queue.offer(POISON, 100, TimeUnit.MILLISECONDS)) {
                // worker lento; espera espaço na fila
            }
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void checkWorker() {
        Throwable err = workerError.get();
        if (err != null) {
            throw new IllegalStateException("Image writer failed", err);
        }
        if (!worker.isAlive() && !finished) {
            throw new IllegalStateException("Image writer stopped unexpectedly");
        }
    }

    private void run() {
        try {
            inserted = gateway.streamInsertImages(new QueueIterator());
        } catch (Throwable t) {
            workerError.set(t);
            logger.error("Image writer error", t);
            queue.clear();
        }
    }

    private final class QueueIterator implements Iterator<ImageRecord> {
        private ImageRecord next;
        private boolean done;

        @Override
        public boolean hasNext() {
            if (done) return false;
            if (next != null) return true;
            try {
                ImageRecord r = queue.take();
                if (r == POISON) {
                    done = true;
                    return false;
                }
                next = r;
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                done = true;
                return false;
            }
        }

        @Override
        public ImageRecord next() {
            if (!hasNext()) throw new NoSuchElementException();
            ImageRecord r = next;
            next = null;
            return r;
        }
    }
}
