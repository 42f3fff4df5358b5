package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies finished batch artifacts to the output strictly in batch order, then
 * deletes them. A batch is finished once its artifact exists under its final
 * name, workers only ever rename a complete file into place.
 *
 * Stops after the last batch has been consumed, which is only known once the
 * input is exhausted, or as soon as anybody reports a failure.
 */
public class OrderedBatchReader implements Callable<Integer> {

	private static final Logger log = LoggerFactory.getLogger(OrderedBatchReader.class);

	public static final int UNKNOWN = -1;

	private final Path tmpDir;
	private final OutputStream out;
	private final AtomicInteger lastBatch;
	private final AtomicReference<Throwable> failure;
	private final long pollIntervalMillis;

	/**
	 * @param lastBatch number of the final batch, {@link #UNKNOWN} while the
	 *                  input is still being read
	 * @param failure   first failure of the run, the reader gives up when set
	 */
	public OrderedBatchReader(Path tmpDir, OutputStream out, AtomicInteger lastBatch, AtomicReference<Throwable> failure,
			long pollIntervalMillis) {
		this.tmpDir = tmpDir;
		this.out = out;
		this.lastBatch = lastBatch;
		this.failure = failure;
		this.pollIntervalMillis = pollIntervalMillis;
	}

	public static Path artifact(Path tmpDir, int batchNumber) {
		return tmpDir.resolve(batchNumber + ".vcf");
	}

	public static Path partialArtifact(Path tmpDir, int batchNumber) {
		return tmpDir.resolve(batchNumber + ".vcf.part");
	}

	/**
	 * @return the number of batches consumed
	 */
	@Override
	public Integer call() throws IOException, InterruptedException {
		int next = 1;
		while (true) {
			int last = lastBatch.get();
			if (last != UNKNOWN && next > last) {
				out.flush();
				log.info("all {} batches consumed", last);
				return last;
			}
			Path ready = artifact(tmpDir, next);
			if (Files.exists(ready)) {
				Files.copy(ready, out);
				Files.delete(ready);
				if (next % 10 == 0) {
					log.info("batch {} consumed", next);
				}
				next++;
			} else if (failure.get() != null) {
				log.warn("giving up before batch {}, the run already failed", next);
				return next - 1;
			} else {
				Thread.sleep(pollIntervalMillis);
			}
		}
	}
}
