package tberg.partialcrf.sequence;

import org.jblas.DoubleMatrix;

import tberg.partialcrf.sequence.ForwardBackward.Lattice;

/**
 * The unrestricted chain: node scores are the batch's emissions and every
 * row shares the model's start, end and transition scores. Parameter values
 * are read once, at construction.
 */
public class CrfLattice implements Lattice {
	
	private final SequenceBatch batch;
	private final DoubleMatrix start;
	private final DoubleMatrix end;
	private final DoubleMatrix[] forwardEdges;
	private final DoubleMatrix[] backwardEdges;
	
	public CrfLattice(CrfParameters params, SequenceBatch batch) {
		if (params.numTags() != batch.numTags()) throw CrfException.shapeMismatch("CrfLattice", "Model has %d tags but emissions have %d", params.numTags(), batch.numTags());
		this.batch = batch;
		int numSequences = batch.numSequences();
		this.start = params.startRow().repmat(numSequences, 1);
		this.end = params.endRow().repmat(numSequences, 1);
		this.forwardEdges = new DoubleMatrix[params.numTags()];
		this.backwardEdges = new DoubleMatrix[params.numTags()];
		for (int s=0; s<params.numTags(); ++s) {
			forwardEdges[s] = params.transitionRow(s, false).repmat(numSequences, 1);
			backwardEdges[s] = params.transitionRow(s, true).repmat(numSequences, 1);
		}
	}
	
	public int numSequences() {
		return batch.numSequences();
	}

	public int paddedLength() {
		return batch.paddedLength();
	}

	public int numStates() {
		return batch.numTags();
	}

	public int sequenceLength(int d) {
		return batch.sequenceLength(d);
	}

	public boolean isValid(int d, int t) {
		return batch.isValid(d, t);
	}

	public DoubleMatrix startLogPotentials() {
		return start;
	}

	public DoubleMatrix endLogPotentials() {
		return end;
	}

	public DoubleMatrix nodeLogPotentials(int t) {
		return batch.emissionsAt(t);
	}

	public DoubleMatrix edgeLogPotentials(int t, int s, boolean backward) {
		return (backward ? backwardEdges[s] : forwardEdges[s]);
	}

}
