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

package edu.berkeley.qtlScan.scanone;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.Callable;

import edu.berkeley.qtlScan.cross.CrossModel;
import edu.berkeley.qtlScan.genotype.GenotypeMatrix;
import edu.berkeley.qtlScan.hmm.GenotypeProbabilities;
import edu.berkeley.qtlScan.hmm.GenotypeProbabilityCalculator;
import edu.berkeley.qtlScan.map.Chromosome;
import edu.berkeley.qtlScan.map.GeneticMap;
import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.regression.HaleyKnottRegression;
import edu.berkeley.qtlScan.regression.ScanPeak;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

// genotype probabilities, regression and LOD curve for one chromosome, reads only shared data
public class ChromosomeScan implements Callable<ChromosomeScanResult> {

	private final int chromosomeIdx;
	private final Chromosome chromosome;
	private final List<Marker> positions;
	private final CrossModel crossModel;
	private final GenotypeMatrix genotypes;
	private final double[][] pheno;
	private final double[] rss0;
	private final ScanOneConfig config;
	private final PrintStream outStream;

	public ChromosomeScan (int chromosomeIdx, Chromosome chromosome, List<Marker> positions, CrossModel crossModel, GenotypeMatrix genotypes,
			double[][] pheno, double[] rss0, ScanOneConfig config, PrintStream outStream) {
		this.chromosomeIdx = chromosomeIdx;
		this.chromosome = chromosome;
		this.positions = positions;
		this.crossModel = crossModel;
		this.genotypes = genotypes;
		this.pheno = pheno;
		this.rss0 = rss0;
		this.config = config;
		this.outStream = outStream;
	}

	@Override
	public ChromosomeScanResult call () {
		long startTime = System.currentTimeMillis();

		double[] recFracs = GeneticMap.recombinationFractions (this.positions, this.config.mapFunction);
		GenotypeProbabilities genoProbs = GenotypeProbabilityCalculator.calcGenoProb (this.crossModel, this.genotypes, this.positions, recFracs, this.config.errorProb);

		TIntList degenerate = new TIntArrayList();
		double[][] rss = HaleyKnottRegression.rss (genoProbs, this.pheno, this.config.addcovar, this.config.intcovar, this.config.weights, 0, this.chromosome.getName(), degenerate);
		double[][] lod = HaleyKnottRegression.rssToLod (rss, this.rss0, this.pheno.length);
		ScanPeak[] peaks = HaleyKnottRegression.getPeak (lod, this.positions, this.rss0.length);

		if (!degenerate.isEmpty()) {
			ScanOne.synchronizedPrintln (this.outStream, "# [WARNING] chromosome " + this.chromosome + ": degenerate design at " + degenerate.size() + " positions, LOD set to NaN.");
		}
		if (this.config.verbose) {
			ScanOne.synchronizedPrintln (this.outStream, "# [CHROMOSOME_" + this.chromosome + "] " + this.positions.size() + " positions, time " + (System.currentTimeMillis() - startTime) + " ms");
		}
		return new ChromosomeScanResult (this.chromosomeIdx, this.chromosome, this.positions, lod, peaks, degenerate);
	}
}
