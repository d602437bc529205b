package tberg.partialcrf.sequence;

import static org.fest.assertions.Assertions.assertThat;
import static org.junit.Assert.assertEquals;

import java.util.Random;

import org.junit.Test;

public class ViterbiTest {

	@Test
	public void testScenarioDecodeIsBestOfEightPaths() {
		CrfParameters params = CrfTestData.scenarioParameters();
		SequenceBatch batch = CrfTestData.scenarioBatch();
		ViterbiPaths result = new LinearChainCRF(params).viterbiDecode(batch);
		double best = Double.NEGATIVE_INFINITY;
		for (int[] path : BruteForce.enumerate(2, 3)) {
			best = Math.max(best, BruteForce.pathScore(params, batch, 0, path));
		}
		assertEquals(best, result.score(0), 1e-12);
		assertEquals(best, BruteForce.pathScore(params, batch, 0, result.path(0)), 1e-12);
		assertThat(result.path(0)).isEqualTo(new int[] {0, 0, 0});
		assertEquals(3.4, result.score(0), 1e-12);
	}
	
	@Test
	public void testDecodeMatchesEnumeration() {
		Random rand = new Random(1);
		for (int trial=0; trial<20; ++trial) {
			CrfParameters params = CrfParameters.random(3, 1.0, rand);
			SequenceBatch batch = CrfTestData.raggedBatch(3, rand);
			ViterbiPaths result = new LinearChainCRF(params).viterbiDecode(batch);
			for (int d=0; d<batch.numSequences(); ++d) {
				int[] expected = BruteForce.bestPath(params, batch, d);
				assertThat(result.path(d)).isEqualTo(expected);
				assertEquals(BruteForce.pathScore(params, batch, d, expected), result.score(d), 1e-9);
			}
		}
	}
	
	@Test
	public void testPathLengthsFollowMask() {
		Random rand = new Random(2);
		SequenceBatch batch = CrfTestData.raggedBatch(4, rand);
		ViterbiPaths result = new LinearChainCRF(4, rand).viterbiDecode(batch);
		assertThat(result.numSequences()).isEqualTo(3);
		assertThat(result.path(0).length).isEqualTo(4);
		assertThat(result.path(1).length).isEqualTo(2);
		assertThat(result.path(2).length).isEqualTo(1);
	}
	
	@Test
	public void testSinglePositionPicksBestStartEmissionEnd() {
		CrfParameters params = new CrfParameters(new double[] {0.0, 1.0, 0.0}, new double[] {0.0, 0.0, 3.0}, new double[3][3]);
		SequenceBatch batch = new SequenceBatch(new double[][][] {{{2.0, 2.5, 0.0}}});
		ViterbiPaths result = new LinearChainCRF(params).viterbiDecode(batch);
		assertThat(result.path(0)).isEqualTo(new int[] {1});
		assertEquals(3.5, result.score(0), 1e-12);
	}
	
	@Test
	public void testConstrainedDecodeStaysInsideCandidates() {
		CrfParameters params = CrfTestData.scenarioParameters();
		SequenceBatch batch = CrfTestData.scenarioBatch();
		CandidateMask candidates = CandidateMask.fromPartialTags(batch, new int[][] {{CandidateMask.UNLABELED, 1, CandidateMask.UNLABELED}});
		ViterbiPaths result = new LinearChainCRF(params).viterbiDecode(batch, candidates);
		int[] path = result.path(0);
		assertThat(path).isEqualTo(new int[] {0, 1, 0});
		double best = Double.NEGATIVE_INFINITY;
		for (int[] candidate : BruteForce.enumerate(2, 3)) {
			if (BruteForce.isConsistent(candidates, 0, candidate)) best = Math.max(best, BruteForce.pathScore(params, batch, 0, candidate));
		}
		assertEquals(best, result.score(0), 1e-9);
		assertEquals(2.4, result.score(0), 1e-9);
	}

}
