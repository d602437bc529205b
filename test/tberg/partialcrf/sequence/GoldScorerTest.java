package tberg.partialcrf.sequence;

import static org.fest.assertions.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Random;

import org.junit.Test;

import tberg.partialcrf.sequence.CrfException.Kind;

public class GoldScorerTest {

	@Test
	public void testScenarioGoldScore() {
		double[] score = GoldScorer.score(CrfTestData.scenarioParameters(), CrfTestData.scenarioBatch(), new int[][] {{0, 1, 0}});
		assertEquals(2.4, score[0], 1e-12);
	}
	
	@Test
	public void testEveryPathMatchesEnumeration() {
		Random rand = new Random(1);
		CrfParameters params = CrfParameters.random(2, 1.0, rand);
		SequenceBatch batch = new SequenceBatch(CrfTestData.randomEmissions(1, 4, 2, 1.0, rand));
		for (int[] path : BruteForce.enumerate(2, 4)) {
			double[] score = GoldScorer.score(params, batch, new int[][] {path});
			assertEquals(BruteForce.pathScore(params, batch, 0, path), score[0], 1e-12);
		}
	}
	
	@Test
	public void testEndScoreUsesEachRowsOwnLastPosition() {
		CrfParameters params = new CrfParameters(new double[] {0.0, 0.0}, new double[] {10.0, 20.0}, new double[2][2]);
		SequenceBatch batch = new SequenceBatch(new double[2][3][2], CrfTestData.prefixMask(3, 3, 2));
		double[] score = GoldScorer.score(params, batch, new int[][] {{0, 0, 1}, {0, 1, 0}});
		assertEquals(20.0, score[0], 0.0);
		assertEquals(20.0, score[1], 0.0);
	}
	
	@Test
	public void testPaddingContributesNothing() {
		Random rand = new Random(2);
		CrfParameters params = CrfParameters.random(3, 1.0, rand);
		SequenceBatch batch = CrfTestData.raggedBatch(3, rand);
		int[][] tags = CrfTestData.randomTags(batch, rand);
		double[] score = GoldScorer.score(params, batch, tags);
		for (int d=0; d<batch.numSequences(); ++d) {
			int[] path = new int[batch.sequenceLength(d)];
			System.arraycopy(tags[d], 0, path, 0, path.length);
			assertEquals(BruteForce.pathScore(params, batch, d, path), score[d], 1e-12);
		}
	}
	
	@Test
	public void testStatisticsCountTheGoldPath() {
		CrfParameters params = CrfTestData.scenarioParameters();
		Marginals stats = GoldScorer.statistics(params, CrfTestData.scenarioBatch(), new int[][] {{0, 1, 0}});
		assertEquals(2.4, stats.logScore(), 1e-12);
		assertThat(stats.startCounts()).isEqualTo(new double[] {1.0, 0.0});
		assertThat(stats.endCounts()).isEqualTo(new double[] {1.0, 0.0});
		assertThat(stats.transitionCounts()[0]).isEqualTo(new double[] {0.0, 1.0});
		assertThat(stats.transitionCounts()[1]).isEqualTo(new double[] {1.0, 0.0});
		assertThat(stats.nodeMarginals(0, 1)).isEqualTo(new double[] {0.0, 1.0});
	}
	
	@Test
	public void testTagsOutOfRangeAreRejected() {
		try {
			GoldScorer.score(CrfTestData.scenarioParameters(), CrfTestData.scenarioBatch(), new int[][] {{0, 2, 0}});
			fail();
		} catch (CrfException e) {
			assertThat(e.getKind()).isEqualTo(Kind.SHAPE_MISMATCH);
		}
	}
	
	@Test
	public void testNegativeLogLikelihoodIsPositive() {
		LinearChainCRF crf = new LinearChainCRF(CrfTestData.scenarioParameters());
		double nll = crf.negativeLogLikelihood(CrfTestData.scenarioBatch(), new int[][] {{0, 1, 0}});
		assertThat(nll).isGreaterThan(0.0);
		assertEquals(crf.logPartition(CrfTestData.scenarioBatch())[0] - 2.4, nll, 1e-12);
	}

}
