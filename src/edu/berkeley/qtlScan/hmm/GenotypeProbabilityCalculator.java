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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.berkeley.qtlScan.cross.CrossModel;
import edu.berkeley.qtlScan.exceptions.QtlException;
import edu.berkeley.qtlScan.genotype.GenotypeMatrix;
import edu.berkeley.qtlScan.genotype.GenotypeSymbolMapper;
import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.utility.LogSum;

// forward only: a position sees the observations up to and including itself
public class GenotypeProbabilityCalculator {

	private final CrossModel crossModel;
	private final double errorProb;

	// emission vectors by symbol, filled while one chromosome is computed
	private final Map<GenotypeSymbolMapper, double[]> emissionCache = new HashMap<GenotypeSymbolMapper, double[]>();

	public GenotypeProbabilityCalculator (CrossModel crossModel, double errorProb) {
		if (!(errorProb > 0d && errorProb < 1d)) throw new IllegalArgumentException ("Genotyping error probability has to be in (0,1), got " + errorProb);
		this.crossModel = crossModel;
		this.errorProb = errorProb;
	}

	public static GenotypeProbabilities calcGenoProb (CrossModel crossModel, GenotypeMatrix genotypes, List<Marker> positions, double[] recFracs, double errorProb) {
		return new GenotypeProbabilityCalculator (crossModel, errorProb).calcGenoProb (genotypes, positions, recFracs);
	}

	public GenotypeProbabilities calcGenoProb (GenotypeMatrix genotypes, List<Marker> positions, double[] recFracs) {
		int numPositions = positions.size();
		if (numPositions > 0 && recFracs.length != numPositions - 1) {
			throw new QtlException.DimensionMismatch ("recombination fractions", numPositions - 1, recFracs.length);
		}

		// genotype column of every position, -1 for pseudomarkers
		int[] columns = new int[numPositions];
		for (int k = 0; k < numPositions; k++) {
			Marker marker = positions.get(k);
			if (marker.isPseudomarker()) {
				columns[k] = -1;
				continue;
			}
			columns[k] = genotypes.markerIndex (marker.getName());
			if (columns[k] < 0) throw new QtlException.DimensionMismatch ("no genotype column for marker " + marker.getName());
		}

		int numStates = this.crossModel.numStates();
		double[][][] stepLogProbs = this.transitionMatrices (recFracs);

		this.emissionCache.clear();
		double[][][] probs = new double[genotypes.numIndividuals()][][];
		LogSum logSum = new LogSum (numStates);
		for (int ind = 0; ind < genotypes.numIndividuals(); ind++) {
			probs[ind] = this.forward (genotypes.getIndividual (ind), columns, stepLogProbs, logSum);
		}
		this.emissionCache.clear();

		return new GenotypeProbabilities (probs, positions, this.crossModel.getPossibleGenotypes());
	}

	private double[][] forward (GenotypeSymbolMapper[] observed, int[] columns, double[][][] stepLogProbs, LogSum logSum) {
		int numStates = this.crossModel.numStates();
		double[][] result = new double[columns.length][];
		if (columns.length == 0) return result;

		double[] alpha = new double[numStates];
		double[] emission = this.emission (observed, columns[0]);
		for (int g = 0; g < numStates; g++) {
			alpha[g] = this.crossModel.initByState (g) + emission[g];
		}
		result[0] = LogSum.logNormalize (alpha);

		for (int k = 1; k < columns.length; k++) {
			emission = this.emission (observed, columns[k]);
			double[] next = new double[numStates];
			for (int g = 0; g < numStates; g++) {
				logSum.reset();
				for (int prev = 0; prev < numStates; prev++) {
					logSum.addLogSummand (alpha[prev] + stepLogProbs[k-1][prev][g]);
				}
				next[g] = emission[g] + logSum.retrieveLogSum();
			}
			// keep the scale in check, the normalised values are what is reported anyway
			double logTotal = LogSum.computeLogSum (next);
			if (logTotal == Double.NEGATIVE_INFINITY) {
				throw new QtlException.IncompatibleCross (this.crossModel.getCrossType().name(), "observations at position " + k + " have probability zero");
			}
			for (int g = 0; g < numStates; g++) next[g] -= logTotal;

			alpha = next;
			result[k] = LogSum.logNormalize (alpha);
		}
		return result;
	}

	private double[] emission (GenotypeSymbolMapper[] observed, int column) {
		if (column < 0) return new double[this.crossModel.numStates()];

		GenotypeSymbolMapper symbol = observed[column];
		double[] logEmission = this.emissionCache.get (symbol);
		if (logEmission == null) {
			logEmission = this.crossModel.emitLogProbs (symbol, this.errorProb);
			this.emissionCache.put (symbol, logEmission);
		}
		return logEmission;
	}

	private double[][][] transitionMatrices (double[] recFracs) {
		int numStates = this.crossModel.numStates();
		double[][][] stepLogProbs = new double[recFracs.length][numStates][numStates];
		for (int k = 0; k < recFracs.length; k++) {
			for (int from = 0; from < numStates; from++) {
				for (int to = 0; to < numStates; to++) {
					stepLogProbs[k][from][to] = this.crossModel.stepByState (from, to, recFracs[k]);
				}
			}
		}
		return stepLogProbs;
	}
}
