 /*
    This file is part of qtlScan.

    qtlScan is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    qtlScan is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with qtlScan.  If not, see <http://www.gnu.org/licenses/>.
  */

package edu.berkeley.qtlScan.hmm;

import java.util.Arrays;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import edu.berkeley.qtlScan.cross.CrossModel;
import edu.berkeley.qtlScan.cross.CrossType;
import edu.berkeley.qtlScan.exceptions.QtlException;
import edu.berkeley.qtlScan.genotype.GenotypeMatrix;
import edu.berkeley.qtlScan.genotype.ObservedGenotypeRegistry;
import edu.berkeley.qtlScan.map.Chromosome;
import edu.berkeley.qtlScan.map.GeneticMap;
import edu.berkeley.qtlScan.map.MapFunction;
import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.map.PseudomarkerFactory;

public class GenotypeProbabilityCalculatorTest {

	private static final double EPSILON = 1e-10;
	private static final Chromosome CHR = Chromosome.fromName ("1");

	private static GenotypeMatrix f2Genotypes (String[][] calls, String... markerNames) {
		ObservedGenotypeRegistry registry = new CrossModel (CrossType.F2).createSymbolRegistry();
		return GenotypeMatrix.decode (calls, Arrays.asList (markerNames), registry);
	}

	@Test
	public void testSingleMarkerPosterior () {
		CrossModel f2 = new CrossModel (CrossType.F2);
		GenotypeMatrix genotypes = f2Genotypes (new String[][] { {"A"}, {"NA"} }, "m1");
		List<Marker> positions = Arrays.asList (new Marker ("m1", CHR, 0d));
		double e = 0.01;

		GenotypeProbabilities probs = GenotypeProbabilityCalculator.calcGenoProb (f2, genotypes, positions, new double[0], e);

		double aa = 0.25 * (1 - e);
		double ab = 0.5 * e / 2;
		double bb = 0.25 * e / 2;
		double total = aa + ab + bb;
		Assert.assertEquals (probs.get (0, 0, 0), aa / total, EPSILON);
		Assert.assertEquals (probs.get (0, 0, 1), ab / total, EPSILON);
		Assert.assertEquals (probs.get (0, 0, 2), bb / total, EPSILON);

		// missing call gives the prior
		Assert.assertEquals (probs.getStateProbs (1, 0), new double[] {0.25, 0.5, 0.25}, EPSILON);
	}

	@Test
	public void testUnlinkedPseudomarkerGetsPrior () {
		CrossModel f2 = new CrossModel (CrossType.F2);
		GenotypeMatrix genotypes = f2Genotypes (new String[][] { {"B"} }, "m1");
		List<Marker> positions = Arrays.asList (new Marker ("m1", CHR, 0d), Marker.pseudomarker (CHR, 500d));

		GenotypeProbabilities probs = GenotypeProbabilityCalculator.calcGenoProb (f2, genotypes, positions, new double[] {0.5}, 0.002);
		Assert.assertEquals (probs.getStateProbs (0, 1), new double[] {0.25, 0.5, 0.25}, EPSILON);
	}

	@Test
	public void testTightLinkageCarriesInformation () {
		CrossModel bc = new CrossModel (CrossType.BC);
		ObservedGenotypeRegistry registry = bc.createSymbolRegistry();
		GenotypeMatrix genotypes = GenotypeMatrix.decode (new String[][] { {"H"} }, Arrays.asList ("m1"), registry);
		List<Marker> positions = Arrays.asList (new Marker ("m1", CHR, 0d), Marker.pseudomarker (CHR, 1d));
		double r = 0.01;
		double e = 0.002;

		GenotypeProbabilities probs = GenotypeProbabilityCalculator.calcGenoProb (bc, genotypes, positions, new double[] {r}, e);

		// P(AB at m1 | H) = 1 - e, then one step
		double expectedAB = (1 - e) * (1 - r) + e * r;
		Assert.assertEquals (probs.get (0, 1, 1), expectedAB, EPSILON);
	}

	@Test
	public void testNoRecombinationKeepsDistribution () {
		CrossModel f2 = new CrossModel (CrossType.F2);
		GenotypeMatrix genotypes = f2Genotypes (new String[][] { {"D"}, {"H"}, {"NA"} }, "m1");
		List<Marker> positions = Arrays.asList (new Marker ("m1", CHR, 10d), Marker.pseudomarker (CHR, 10d));

		GenotypeProbabilities probs = GenotypeProbabilityCalculator.calcGenoProb (f2, genotypes, positions, new double[] {0d}, 0.002);

		for (int ind = 0; ind < probs.numIndividuals(); ind++) {
			Assert.assertEquals (probs.getStateProbs (ind, 1), probs.getStateProbs (ind, 0), EPSILON);
		}
		// not-B: AA and AB in prior proportion, BB only through the error
		Assert.assertEquals (probs.get (0, 1, 1) / probs.get (0, 1, 0), 2d, EPSILON);
		Assert.assertTrue (probs.get (0, 1, 2) < 1e-3);
	}

	@Test
	public void testRowsSumToOne () {
		for (CrossType crossType : CrossType.values()) {
			CrossModel cross = new CrossModel (crossType);
			ObservedGenotypeRegistry registry = cross.createSymbolRegistry();
			String[] ids = crossType.defaultGenotypeIds.split (" ");
			String[][] calls = { {ids[0], "NA", ids[1]}, {ids[1], ids[1], "-"}, {ids[0], ids[1], ids[0]} };
			GenotypeMatrix genotypes = GenotypeMatrix.decode (calls, Arrays.asList ("m1", "m2", "m3"), registry);

			List<Marker> markers = Arrays.asList (new Marker ("m1", CHR, 0d), new Marker ("m2", CHR, 7d), new Marker ("m3", CHR, 15d));
			List<Marker> positions = PseudomarkerFactory.getPseudomarkerFactory ("stepped").addPseudomarkers (markers, 2d);
			double[] recFracs = GeneticMap.recombinationFractions (positions, new MapFunction.Kosambi());

			GenotypeProbabilities probs = GenotypeProbabilityCalculator.calcGenoProb (cross, genotypes, positions, recFracs, 0.002);
			Assert.assertEquals (probs.numPositions(), positions.size());
			for (int ind = 0; ind < probs.numIndividuals(); ind++) {
				for (int pos = 0; pos < probs.numPositions(); pos++) {
					double sum = 0d;
					for (double p : probs.getStateProbs (ind, pos)) {
						Assert.assertTrue (p >= 0d && p <= 1d);
						sum += p;
					}
					Assert.assertEquals (sum, 1d, 1e-9, crossType + " ind " + ind + " pos " + pos);
				}
			}
		}
	}

	@Test(expectedExceptions = QtlException.DimensionMismatch.class)
	public void testMarkerWithoutGenotypes () {
		CrossModel f2 = new CrossModel (CrossType.F2);
		GenotypeMatrix genotypes = f2Genotypes (new String[][] { {"A"} }, "m1");
		List<Marker> positions = Arrays.asList (new Marker ("m1", CHR, 0d), new Marker ("m2", CHR, 5d));
		GenotypeProbabilityCalculator.calcGenoProb (f2, genotypes, positions, new double[] {0.05}, 0.002);
	}

	@Test(expectedExceptions = QtlException.DimensionMismatch.class)
	public void testRecombinationFractionCount () {
		CrossModel f2 = new CrossModel (CrossType.F2);
		GenotypeMatrix genotypes = f2Genotypes (new String[][] { {"A"} }, "m1");
		List<Marker> positions = Arrays.asList (new Marker ("m1", CHR, 0d), Marker.pseudomarker (CHR, 5d));
		GenotypeProbabilityCalculator.calcGenoProb (f2, genotypes, positions, new double[] {0.05, 0.05}, 0.002);
	}
}
