package tberg.partialcrf.sequence;

import java.util.List;
import java.util.Set;

import tberg.partialcrf.arrays.a;

/**
 * Which tags are admissible at each position of each row, as a
 * [batch][padded length][tags] allow matrix. Entries at padding positions
 * are ignored.
 */
public class CandidateMask {
	
	/**
	 * Tag value meaning "any tag" in partially labeled sequences.
	 */
	public static final int UNLABELED = -1;
	
	private final boolean[][][] allowed;
	private final int numTags;
	
	private CandidateMask(boolean[][][] allowed, int numTags) {
		this.allowed = allowed;
		this.numTags = numTags;
	}
	
	public static CandidateMask fromAllowMatrix(boolean[][][] allowed) {
		if (allowed.length == 0 || allowed[0].length == 0) throw CrfException.shapeMismatch("CandidateMask.fromAllowMatrix", "Allow matrix must have at least one row and one position");
		int length = allowed[0].length;
		int numTags = allowed[0][0].length;
		for (int d=0; d<allowed.length; ++d) {
			if (allowed[d].length != length) throw CrfException.shapeMismatch("CandidateMask.fromAllowMatrix", "Row %d has length %d, expected %d", d, allowed[d].length, length);
			for (int t=0; t<length; ++t) {
				if (allowed[d][t].length != numTags) throw CrfException.shapeMismatch("CandidateMask.fromAllowMatrix", "Row %d position %d has %d tags, expected %d", d, t, allowed[d][t].length, numTags);
			}
		}
		return new CandidateMask(a.copy(allowed), numTags);
	}
	
	/**
	 * Singleton candidate sets: only the gold tag is allowed at each valid
	 * position.
	 */
	public static CandidateMask fromGoldTags(SequenceBatch batch, int[][] tags) {
		batch.checkTags(tags, "CandidateMask.fromGoldTags");
		boolean[][][] allowed = new boolean[batch.numSequences()][batch.paddedLength()][batch.numTags()];
		for (int d=0; d<batch.numSequences(); ++d) {
			for (int t=0; t<batch.sequenceLength(d); ++t) {
				allowed[d][t][tags[d][t]] = true;
			}
		}
		return new CandidateMask(allowed, batch.numTags());
	}

	/**
	 * Like fromGoldTags, except that a position tagged UNLABELED allows every
	 * tag.
	 */
	public static CandidateMask fromPartialTags(SequenceBatch batch, int[][] tags) {
		if (tags.length != batch.numSequences()) throw CrfException.shapeMismatch("CandidateMask.fromPartialTags", "Tags have %d rows but batch has %d", tags.length, batch.numSequences());
		boolean[][][] allowed = new boolean[batch.numSequences()][batch.paddedLength()][batch.numTags()];
		for (int d=0; d<batch.numSequences(); ++d) {
			if (tags[d].length != batch.paddedLength()) throw CrfException.shapeMismatch("CandidateMask.fromPartialTags", "Tag row %d has length %d, expected %d", d, tags[d].length, batch.paddedLength());
			for (int t=0; t<batch.sequenceLength(d); ++t) {
				int tag = tags[d][t];
				if (tag == UNLABELED) {
					for (int s=0; s<batch.numTags(); ++s) allowed[d][t][s] = true;
				} else if (tag >= 0 && tag < batch.numTags()) {
					allowed[d][t][tag] = true;
				} else {
					throw CrfException.shapeMismatch("CandidateMask.fromPartialTags", "Tag %d at row %d position %d is neither UNLABELED nor in [0, %d)", tag, d, t, batch.numTags());
				}
			}
		}
		return new CandidateMask(allowed, batch.numTags());
	}
	
	/**
	 * Row d lists one candidate set per position; positions beyond the end of
	 * a row's list are left empty.
	 */
	public static CandidateMask fromTagSets(List<List<Set<Integer>>> tagSets, int paddedLength, int numTags) {
		boolean[][][] allowed = new boolean[tagSets.size()][paddedLength][numTags];
		for (int d=0; d<tagSets.size(); ++d) {
			List<Set<Integer>> row = tagSets.get(d);
			if (row.size() > paddedLength) throw CrfException.shapeMismatch("CandidateMask.fromTagSets", "Row %d has %d candidate sets but padded length is %d", d, row.size(), paddedLength);
			for (int t=0; t<row.size(); ++t) {
				for (Integer tag : row.get(t)) {
					if (tag == null || tag < 0 || tag >= numTags) throw CrfException.shapeMismatch("CandidateMask.fromTagSets", "Tag %s at row %d position %d is outside [0, %d)", tag, d, t, numTags);
					allowed[d][t][tag] = true;
				}
			}
		}
		return new CandidateMask(allowed, numTags);
	}
	
	/**
	 * Every valid position of the batch must have at least one admissible tag.
	 */
	public void validate(SequenceBatch batch) {
		if (numSequences() != batch.numSequences() || paddedLength() != batch.paddedLength() || numTags != batch.numTags()) {
			throw CrfException.shapeMismatch("CandidateMask.validate", "Candidates are %dx%dx%d but batch is %dx%dx%d", numSequences(), paddedLength(), numTags, batch.numSequences(), batch.paddedLength(), batch.numTags());
		}
		for (int d=0; d<batch.numSequences(); ++d) {
			for (int t=0; t<batch.sequenceLength(d); ++t) {
				if (numAllowed(d, t) == 0) {
					throw new CrfException(CrfException.Kind.EMPTY_CANDIDATE_SET, "[CandidateMask.validate] No admissible tag at row " + d + " position " + t);
				}
			}
		}
	}
	
	public int numSequences() {
		return allowed.length;
	}
	
	public int paddedLength() {
		return (allowed.length == 0 ? 0 : allowed[0].length);
	}
	
	public int numTags() {
		return numTags;
	}
	
	public boolean isAllowed(int d, int t, int s) {
		return allowed[d][t][s];
	}
	
	public int numAllowed(int d, int t) {
		return a.count(allowed[d][t]);
	}
	
	public boolean[][][] toArray() {
		return a.copy(allowed);
	}
	
}
