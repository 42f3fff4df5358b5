package edu.harvard.hms.dbmi.avillach.gvcf.etl.genotype;

import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ticker;

/**
 * Batch size for the {@link LineBatcher}, asked once per batch.
 *
 * With a fixed size the answer never changes. Otherwise the size starts at
 * {@link #INITIAL_SIZE} and every {@code workers} batches the wall-clock time
 * spent on the last round is compared with [{@link #LOW_SECONDS},
 * {@link #HIGH_SECONDS}]: a fast round grows the size, a slow one shrinks it.
 * The first round is never used for adjusting since the workers were idle.
 */
public class AdaptiveBatchSizer implements IntSupplier {

	private static final Logger log = LoggerFactory.getLogger(AdaptiveBatchSizer.class);

	public static final int INITIAL_SIZE = 20000;
	public static final long LOW_SECONDS = 120, HIGH_SECONDS = 600;

	private final boolean adaptive;
	private final int workers;
	private final Ticker ticker;

	private int size;
	private int batchNumber = 0;
	private long roundStart;

	private AdaptiveBatchSizer(int size, boolean adaptive, int workers, Ticker ticker) {
		this.size = size;
		this.adaptive = adaptive;
		this.workers = workers;
		this.ticker = ticker;
		this.roundStart = ticker.read();
	}

	public static AdaptiveBatchSizer fixed(int size) {
		if (size < 1) {
			throw new IllegalArgumentException("batch size must be positive, got " + size);
		}
		return new AdaptiveBatchSizer(size, false, 1, Ticker.systemTicker());
	}

	public static AdaptiveBatchSizer adaptive(int workers) {
		return adaptive(workers, Ticker.systemTicker());
	}

	static AdaptiveBatchSizer adaptive(int workers, Ticker ticker) {
		if (workers < 1) {
			throw new IllegalArgumentException("need at least one batch worker, got " + workers);
		}
		return new AdaptiveBatchSizer(INITIAL_SIZE, true, workers, ticker);
	}

	/**
	 * @param configured the configured size, 0 meaning adaptive
	 */
	public static AdaptiveBatchSizer forConfig(int configured, int workers) {
		return configured == 0 ? adaptive(workers) : fixed(configured);
	}

	@Override
	public int getAsInt() {
		batchNumber++;
		if (adaptive && batchNumber % workers == 0) {
			long now = ticker.read();
			if (batchNumber > workers) {
				adjust(TimeUnit.NANOSECONDS.toSeconds(now - roundStart));
			}
			roundStart = now;
		}
		return size;
	}

	private void adjust(long elapsed) {
		if (elapsed < LOW_SECONDS) {
			size = Math.max(1, (int) (1.2 * size * LOW_SECONDS / (elapsed + 1)));
			log.info("batch {}: adjusting batch size up to {}", batchNumber, size);
		} else if (elapsed > HIGH_SECONDS) {
			size = Math.max(1, (int) (size * (double) HIGH_SECONDS / elapsed / 1.2));
			log.info("batch {}: adjusting batch size down to {}", batchNumber, size);
		}
	}

	public boolean isAdaptive() {
		return adaptive;
	}
}
