package edu.harvard.hms.dbmi.avillach.gvcf.data.genotype;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import edu.harvard.hms.dbmi.avillach.gvcf.exception.VcfFormatException;

/**
 * The FORMAT column of a record, parsed once. Positions of the keys the
 * pipeline cares about are resolved up front, -1 meaning absent.
 *
 * Also knows the output layout of cleaned calls: AF moved (or added) right
 * after GT, and DP added right before AD when the caller didn't provide it.
 */
public class FormatKeys {

	public static final String GT = "GT", AF = "AF", DP = "DP", DPI = "DPI", MIN_DP = "MIN_DP", AD = "AD", ADF = "ADF",
			ADR = "ADR", PL = "PL", GQ = "GQ", GQX = "GQX", RR = "RR", BF = "BF", FR = "FR", BP = "BP";

	private static final Splitter KEY_SPLITTER = Splitter.on(':');
	private static final Joiner KEY_JOINER = Joiner.on(':');

	/** output slot holding the AF value */
	static final int AF_SLOT = -1;
	/** output slot holding an inserted DP value */
	static final int DP_SLOT = -2;

	private final String raw;
	private final ImmutableList<String> keys;
	public final int gt, af, dp, dpi, minDp, ad, adf, adr, pl, gq, gqx, rr, bf, fr, bp;

	private int[] outputLayout;

	public FormatKeys(String format) {
		this.raw = format;
		this.keys = ImmutableList.copyOf(KEY_SPLITTER.split(format));
		this.gt = keys.indexOf(GT);
		this.af = keys.indexOf(AF);
		this.dp = keys.indexOf(DP);
		this.dpi = keys.indexOf(DPI);
		this.minDp = keys.indexOf(MIN_DP);
		this.ad = keys.indexOf(AD);
		this.adf = keys.indexOf(ADF);
		this.adr = keys.indexOf(ADR);
		this.pl = keys.indexOf(PL);
		this.gq = keys.indexOf(GQ);
		this.gqx = keys.indexOf(GQX);
		this.rr = keys.indexOf(RR);
		this.bf = keys.indexOf(BF);
		this.fr = keys.indexOf(FR);
		this.bp = keys.indexOf(BP);
	}

	public List<String> keys() {
		return keys;
	}

	public String raw() {
		return raw;
	}

	public boolean has(int index) {
		return index >= 0;
	}

	/**
	 * Checks the keys the call filter cannot work without: GT in first position,
	 * DP or AD, GQ or GQX.
	 */
	public void requireFilterKeys(long lineNumber) {
		if (gt != 0) {
			throw new VcfFormatException(gt < 0 ? "no GT key in FORMAT " + raw : "GT is not the first key in FORMAT " + raw, lineNumber);
		}
		if (dp < 0 && ad < 0) {
			throw new VcfFormatException("no AD or DP key in FORMAT " + raw, lineNumber);
		}
		if (gq < 0 && gqx < 0) {
			throw new VcfFormatException("no GQ or GQX key in FORMAT " + raw, lineNumber);
		}
	}

	private int[] outputLayout() {
		if (outputLayout == null) {
			List<Integer> layout = new ArrayList<>(keys.size() + 2);
			for (int i = 0; i < keys.size(); i++) {
				if (i == af) {
					continue;
				}
				if (i == ad && dp < 0) {
					layout.add(DP_SLOT);
				}
				layout.add(i);
				if (i == gt) {
					layout.add(AF_SLOT);
				}
			}
			outputLayout = layout.stream().mapToInt(Integer::intValue).toArray();
		}
		return outputLayout;
	}

	/**
	 * @return the FORMAT column of cleaned records
	 */
	public String outputColumn() {
		List<String> out = new ArrayList<>();
		for (int slot : outputLayout()) {
			out.add(slot == AF_SLOT ? AF : slot == DP_SLOT ? DP : keys.get(slot));
		}
		return KEY_JOINER.join(out);
	}

	/**
	 * Renders a cleaned call in the output layout. NOCALLs are just {@code ./.}.
	 */
	public String render(SampleCall call) {
		if (call.isNoCall()) {
			return Genotype.NOCALL;
		}
		StringBuilder sb = new StringBuilder();
		for (int slot : outputLayout()) {
			if (sb.length() > 0) {
				sb.append(':');
			}
			String value;
			if (slot == AF_SLOT) {
				value = call.af();
			} else if (slot == DP_SLOT) {
				value = call.insertedDp();
			} else if (slot == gt) {
				value = call.genotype().toString();
			} else {
				value = call.value(slot);
			}
			sb.append(value == null ? "." : value);
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return raw;
	}
}
