package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import edu.harvard.hms.dbmi.avillach.gvcf.exception.BatchFailedException;
import edu.harvard.hms.dbmi.avillach.gvcf.exception.TempDirectoryException;

/**
 * Runs the {@link BatchProcessor} over every batch of a {@link LineBatcher} on
 * {@code jobs - 1} worker threads, while one more thread, the
 * {@link OrderedBatchReader}, streams finished batches to the output in input
 * order. The output is byte-identical whatever the number of jobs.
 *
 * Each worker writes its batch to {@code N.vcf.part} in the temp directory and
 * renames it to {@code N.vcf} when complete. The temp directory must not exist
 * beforehand, it is created and removed by {@link #run}.
 *
 * Any failure aborts the whole run: no further batch is submitted, outstanding
 * work is cancelled and the failure is rethrown, wrapped in a
 * {@link BatchFailedException} when a worker failed.
 */
public class BatchOrchestrator {

	private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

	private final BatchProcessor processor;
	private final int jobs;
	private final Path tmpDir;
	private final long pollIntervalMillis;

	public BatchOrchestrator(BatchProcessor processor, int jobs, Path tmpDir, long pollIntervalMillis) {
		if (jobs < 2) {
			throw new IllegalArgumentException("jobs must be at least 2 (one ordered reader plus at least one worker), got " + jobs);
		}
		if (pollIntervalMillis < 1) {
			throw new IllegalArgumentException("poll interval must be positive, got " + pollIntervalMillis);
		}
		this.processor = processor;
		this.jobs = jobs;
		this.tmpDir = tmpDir;
		this.pollIntervalMillis = pollIntervalMillis;
	}

	public int getWorkerCount() {
		return jobs - 1;
	}

	/**
	 * @param batcher source of the data lines, header already consumed
	 * @param out     receives the processed data lines, anything written
	 *                before (the header) must already be flushed
	 */
	public RunSummary run(LineBatcher batcher, OutputStream out) throws IOException, InterruptedException {
		createTmpDir();

		AtomicReference<Throwable> failure = new AtomicReference<>();
		AtomicInteger lastBatch = new AtomicInteger(OrderedBatchReader.UNKNOWN);
		AtomicLong linesRead = new AtomicLong();
		AtomicLong recordsWritten = new AtomicLong();
		CallFixCounters counters = new CallFixCounters();
		Semaphore inFlight = new Semaphore(getWorkerCount());

		ExecutorService readerPool = Executors.newSingleThreadExecutor(
				new ThreadFactoryBuilder().setNameFormat("ordered-reader").setDaemon(true).build());
		ExecutorService workerPool = Executors.newFixedThreadPool(getWorkerCount(),
				new ThreadFactoryBuilder().setNameFormat("batch-worker-%d").setDaemon(true).build());

		boolean finished = false;
		try {
			Future<Integer> reader = readerPool.submit(() -> {
				try {
					return new OrderedBatchReader(tmpDir, out, lastBatch, failure, pollIntervalMillis).call();
				} catch (Exception e) {
					failure.compareAndSet(null, e);
					throw e;
				}
			});

			try {
				Batch batch;
				while (failure.get() == null && (batch = batcher.next()) != null) {
					while (!inFlight.tryAcquire(pollIntervalMillis, TimeUnit.MILLISECONDS)) {
						if (failure.get() != null) {
							break;
						}
					}
					if (failure.get() != null) {
						break;
					}
					Batch current = batch;
					workerPool.execute(() -> {
						try {
							BatchResult result = processToArtifact(current);
							linesRead.addAndGet(result.linesRead());
							recordsWritten.addAndGet(result.recordsWritten());
							counters.add(result.counters());
						} catch (Throwable t) {
							log.error("batch {} failed", current.number(), t);
							failure.compareAndSet(null, new BatchFailedException(current.number(), t));
						} finally {
							inFlight.release();
						}
					});
				}
			} catch (IOException | RuntimeException e) {
				failure.compareAndSet(null, e);
			}
			lastBatch.set(batcher.getBatchCount());

			workerPool.shutdown();
			awaitTermination(workerPool, failure);
			try {
				reader.get();
			} catch (ExecutionException e) {
				failure.compareAndSet(null, e.getCause());
			} finally {
				readerPool.shutdownNow();
			}
			finished = true;
		} finally {
			if (!finished) {
				abort(failure, readerPool, workerPool);
			}
		}

		Throwable failed = failure.get();
		if (failed != null) {
			cleanTmpDir();
			throwFailure(failed);
		}
		removeTmpDir();
		return new RunSummary(batcher.getBatchCount(), linesRead.get(), recordsWritten.get(), counters);
	}

	/**
	 * The run is leaving on an exception of its own (interrupted or an Error):
	 * stop both pools and drop whatever the workers already wrote.
	 */
	private void abort(AtomicReference<Throwable> failure, ExecutorService readerPool, ExecutorService workerPool) {
		failure.compareAndSet(null, new IllegalStateException("run aborted"));
		workerPool.shutdownNow();
		readerPool.shutdownNow();
		try {
			if (!workerPool.awaitTermination(1, TimeUnit.MINUTES) || !readerPool.awaitTermination(1, TimeUnit.MINUTES)) {
				log.warn("threads still running after the run was aborted");
			}
		} catch (InterruptedException e) {
			log.warn("interrupted while waiting for the aborted run's threads", e);
			Thread.currentThread().interrupt();
		}
		cleanTmpDir();
	}

	BatchResult processToArtifact(Batch batch) throws IOException {
		Path partial = OrderedBatchReader.partialArtifact(tmpDir, batch.number());
		BatchResult result;
		try (BufferedWriter writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
			result = processor.process(batch, writer);
		}
		Files.move(partial, OrderedBatchReader.artifact(tmpDir, batch.number()), StandardCopyOption.ATOMIC_MOVE);
		return result;
	}

	private void awaitTermination(ExecutorService pool, AtomicReference<Throwable> failure) throws InterruptedException {
		while (!pool.awaitTermination(pollIntervalMillis, TimeUnit.MILLISECONDS)) {
			if (failure.get() != null) {
				List<Runnable> cancelled = pool.shutdownNow();
				log.warn("run failed, {} queued batches cancelled", cancelled.size());
				pool.awaitTermination(1, TimeUnit.MINUTES);
				return;
			}
		}
	}

	private static void throwFailure(Throwable failed) throws IOException {
		if (failed instanceof RuntimeException e) {
			throw e;
		}
		if (failed instanceof IOException e) {
			throw e;
		}
		if (failed instanceof Error e) {
			throw e;
		}
		throw new IllegalStateException(failed);
	}

	private void createTmpDir() {
		try {
			Path parent = tmpDir.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.createDirectory(tmpDir);
		} catch (FileAlreadyExistsException e) {
			throw new TempDirectoryException("temp directory " + tmpDir + " already exists, remove it or choose another one", e);
		} catch (IOException e) {
			throw new TempDirectoryException("cannot create temp directory " + tmpDir, e);
		}
	}

	private void removeTmpDir() {
		try (Stream<Path> leftovers = Files.list(tmpDir)) {
			List<Path> remaining = leftovers.collect(Collectors.toList());
			if (!remaining.isEmpty()) {
				throw new TempDirectoryException("temp directory " + tmpDir + " still holds " + remaining + " after the run");
			}
			Files.delete(tmpDir);
		} catch (IOException e) {
			throw new TempDirectoryException("cannot remove temp directory " + tmpDir, e);
		}
	}

	/**
	 * Best effort after a failure, the first failure is what gets reported.
	 */
	private void cleanTmpDir() {
		try (Stream<Path> paths = Files.walk(tmpDir)) {
			for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
				Files.deleteIfExists(path);
			}
		} catch (IOException | UncheckedIOException e) {
			log.warn("could not clean up temp directory {} after the failure", tmpDir, e);
		}
	}
}
