package tberg.partialcrf.sequence;

import org.jblas.DoubleMatrix;

import tberg.partialcrf.sequence.ForwardBackward.Lattice;

/**
 * A view of another lattice in which every tag outside a position's
 * candidate set is impossible. Node scores of disallowed tags, edges with a
 * disallowed endpoint and end scores of tags disallowed at a row's last
 * position all read as impossibleScore. The wrapped lattice is never
 * written; restricted scores live in fresh matrices.
 * 
 * Running forward-backward over this view sums exactly the paths that are
 * consistent with every candidate set, up to terms of order
 * exp(impossibleScore).
 */
public class RestrictedLattice implements Lattice {
	
	private final Lattice lattice;
	private final CandidateMask candidates;
	private final double impossibleScore;
	private final DoubleMatrix[] nodes;
	private final DoubleMatrix end;
	
	public RestrictedLattice(Lattice lattice, CandidateMask candidates, double impossibleScore) {
		if (candidates.numSequences() != lattice.numSequences() || candidates.paddedLength() != lattice.paddedLength() || candidates.numTags() != lattice.numStates()) {
			throw CrfException.shapeMismatch("RestrictedLattice", "Candidates are %dx%dx%d but lattice is %dx%dx%d", candidates.numSequences(), candidates.paddedLength(), candidates.numTags(), lattice.numSequences(), lattice.paddedLength(), lattice.numStates());
		}
		this.lattice = lattice;
		this.candidates = candidates;
		this.impossibleScore = impossibleScore;
		this.nodes = new DoubleMatrix[lattice.paddedLength()];
		for (int t=0; t<nodes.length; ++t) {
			DoubleMatrix scores = lattice.nodeLogPotentials(t).dup();
			for (int d=0; d<numSequences(); ++d) {
				for (int s=0; s<numStates(); ++s) {
					if (!candidates.isAllowed(d, t, s)) scores.put(d, s, impossibleScore);
				}
			}
			nodes[t] = scores;
		}
		this.end = lattice.endLogPotentials().dup();
		for (int d=0; d<numSequences(); ++d) {
			int last = lattice.sequenceLength(d)-1;
			for (int s=0; s<numStates(); ++s) {
				if (!candidates.isAllowed(d, last, s)) end.put(d, s, impossibleScore);
			}
		}
	}
	
	public int numSequences() {
		return lattice.numSequences();
	}

	public int paddedLength() {
		return lattice.paddedLength();
	}

	public int numStates() {
		return lattice.numStates();
	}

	public int sequenceLength(int d) {
		return lattice.sequenceLength(d);
	}

	public boolean isValid(int d, int t) {
		return lattice.isValid(d, t);
	}

	public DoubleMatrix startLogPotentials() {
		return lattice.startLogPotentials();
	}

	public DoubleMatrix endLogPotentials() {
		return end;
	}

	public DoubleMatrix nodeLogPotentials(int t) {
		return nodes[t];
	}

	public DoubleMatrix edgeLogPotentials(int t, int s, boolean backward) {
		DoubleMatrix scores = lattice.edgeLogPotentials(t, s, backward).dup();
		// s sits at t-1 going backward, at t going forward
		int sTime = (backward ? t-1 : t);
		int otherTime = (backward ? t : t-1);
		for (int d=0; d<numSequences(); ++d) {
			boolean sAllowed = candidates.isAllowed(d, sTime, s);
			for (int other=0; other<numStates(); ++other) {
				if (!sAllowed || !candidates.isAllowed(d, otherTime, other)) scores.put(d, other, impossibleScore);
			}
		}
		return scores;
	}

}
