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

package edu.berkeley.qtlScan.regression;

import java.util.Arrays;
import java.util.List;

import Jama.Matrix;
import Jama.QRDecomposition;

import edu.berkeley.qtlScan.exceptions.QtlException;
import edu.berkeley.qtlScan.hmm.GenotypeProbabilities;
import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.phenotype.PhenotypeMatrix;
import gnu.trove.list.TIntList;

// inputs are [individual][column]; covariates and weights may be null or empty
public class HaleyKnottRegression {

	// relative to the largest diagonal entry of R
	public static final double RANK_TOLERANCE = 1e-10;

	private HaleyKnottRegression () {
	}

	// residual sum of squares per phenotype of the model without a QTL
	public static double[] nullRss (double[][] pheno, double[][] addcovar, double[] weights) {
		int numInd = pheno.length;
		checkRows ("additive covariates", numInd, addcovar);
		checkWeights (numInd, weights);

		int numAdd = numColumns (addcovar);
		double[][] design = new double[numInd][1 + numAdd];
		for (int i = 0; i < numInd; i++) {
			design[i][0] = 1d;
			for (int c = 0; c < numAdd; c++) design[i][1 + c] = addcovar[i][c];
		}
		return fit (design, pheno, weights, "null model", -1);
	}

	public static double[][] rss (GenotypeProbabilities genoProbs, double[][] pheno, double[][] addcovar, double[][] intcovar, double[] weights) {
		return rss (genoProbs, pheno, addcovar, intcovar, weights, 0, "", null);
	}

	// [position][phenotype]; design is intercept, addcovar, non-baseline probabilities, intcovar times those.
	// Rank deficient positions get NaN and go to degeneratePositions.
	public static double[][] rss (GenotypeProbabilities genoProbs, double[][] pheno, double[][] addcovar, double[][] intcovar, double[] weights,
			int baseline, String chromosome, TIntList degeneratePositions) {
		int numInd = genoProbs.numIndividuals();
		if (pheno.length != numInd) throw new QtlException.DimensionMismatch ("phenotype rows", numInd, pheno.length);
		checkRows ("additive covariates", numInd, addcovar);
		checkRows ("interactive covariates", numInd, intcovar);
		checkWeights (numInd, weights);
		checkNoMissing (pheno);

		int numStates = genoProbs.numStates();
		if (baseline < 0 || baseline >= numStates) throw new IllegalArgumentException ("Baseline state " + baseline + " not in [0," + numStates + ")");

		int numAdd = numColumns (addcovar);
		int numInt = numColumns (intcovar);
		int numGeno = numStates - 1;
		int numCols = 1 + numAdd + numGeno + numInt * numGeno;
		int numPhe = numColumns (pheno);

		double[][] result = new double[genoProbs.numPositions()][];
		double[][] design = new double[numInd][numCols];
		for (int pos = 0; pos < genoProbs.numPositions(); pos++) {
			for (int i = 0; i < numInd; i++) {
				double[] row = design[i];
				double[] stateProbs = genoProbs.getStateProbs (i, pos);
				int col = 0;
				row[col++] = 1d;
				for (int c = 0; c < numAdd; c++) row[col++] = addcovar[i][c];
				int firstGeno = col;
				for (int s = 0; s < numStates; s++) {
					if (s != baseline) row[col++] = stateProbs[s];
				}
				for (int c = 0; c < numInt; c++) {
					for (int g = 0; g < numGeno; g++) row[col++] = intcovar[i][c] * row[firstGeno + g];
				}
			}

			try {
				result[pos] = fit (design, pheno, weights, chromosome, pos);
			}
			catch (QtlException.DegenerateDesign e) {
				result[pos] = new double[numPhe];
				Arrays.fill (result[pos], Double.NaN);
				if (degeneratePositions != null) degeneratePositions.add (pos);
			}
		}
		return result;
	}

	// least squares fit of every phenotype column, returns the residual sums of squares
	private static double[] fit (double[][] design, double[][] pheno, double[] weights, String chromosome, int positionIdx) {
		int numInd = design.length;
		int numCols = numInd == 0 ? 0 : design[0].length;
		int numPhe = numColumns (pheno);
		if (numInd < numCols) throw new QtlException.DegenerateDesign (chromosome, positionIdx, numInd, numCols);

		Matrix x = new Matrix (numInd, numCols);
		Matrix y = new Matrix (numInd, numPhe);
		boolean weighted = weights != null && weights.length > 0;
		for (int i = 0; i < numInd; i++) {
			double w = weighted ? weights[i] : 1d;
			for (int c = 0; c < numCols; c++) x.set (i, c, w * design[i][c]);
			for (int j = 0; j < numPhe; j++) y.set (i, j, w * pheno[i][j]);
		}

		QRDecomposition qr = new QRDecomposition (x);
		int rank = rank (qr.getR());
		if (rank < numCols) throw new QtlException.DegenerateDesign (chromosome, positionIdx, rank, numCols);

		Matrix residuals = y.minus (x.times (qr.solve (y)));
		double[] rss = new double[numPhe];
		for (int j = 0; j < numPhe; j++) {
			double sum = 0d;
			for (int i = 0; i < numInd; i++) {
				double r = residuals.get (i, j);
				sum += r * r;
			}
			rss[j] = sum;
		}
		return rss;
	}

	static int rank (Matrix r) {
		int n = Math.min (r.getRowDimension(), r.getColumnDimension());
		double maxDiag = 0d;
		for (int k = 0; k < n; k++) maxDiag = Math.max (maxDiag, Math.abs (r.get (k, k)));
		if (maxDiag == 0d) return 0;

		int rank = 0;
		for (int k = 0; k < n; k++) {
			if (Math.abs (r.get (k, k)) > RANK_TOLERANCE * maxDiag) rank++;
		}
		return rank;
	}

	// (n/2) log10 (rss0/rss), [position][phenotype]
	public static double[][] rssToLod (double[][] rss, double[] rss0, int numInd) {
		double[][] lod = new double[rss.length][];
		for (int pos = 0; pos < rss.length; pos++) {
			if (rss[pos].length != rss0.length) throw new QtlException.DimensionMismatch ("phenotypes", rss0.length, rss[pos].length);
			lod[pos] = new double[rss0.length];
			for (int j = 0; j < rss0.length; j++) {
				lod[pos][j] = numInd / 2d * Math.log10 (rss0[j] / rss[pos][j]);
			}
		}
		return lod;
	}

	// first position of the maximum for each phenotype, NaN entries ignored
	public static ScanPeak[] getPeak (double[][] lod, List<Marker> positions, int numPhe) {
		if (lod.length != positions.size()) throw new QtlException.DimensionMismatch ("positions", positions.size(), lod.length);

		ScanPeak[] peaks = new ScanPeak[numPhe];
		for (int j = 0; j < numPhe; j++) {
			double maxLod = Double.NaN;
			Marker maxPos = null;
			for (int pos = 0; pos < lod.length; pos++) {
				double value = lod[pos][j];
				if (Double.isNaN (value)) continue;
				if (maxPos == null || value > maxLod) {
					maxLod = value;
					maxPos = positions.get(pos);
				}
			}
			peaks[j] = new ScanPeak (j, maxLod, maxPos);
		}
		return peaks;
	}

	private static int numColumns (double[][] matrix) {
		if (matrix == null || matrix.length == 0) return 0;
		return matrix[0].length;
	}

	private static void checkRows (String what, int numInd, double[][] matrix) {
		if (matrix == null || matrix.length == 0) return;
		if (matrix.length != numInd) throw new QtlException.DimensionMismatch (what, numInd, matrix.length);
	}

	private static void checkWeights (int numInd, double[] weights) {
		if (weights == null || weights.length == 0) return;
		if (weights.length != numInd) throw new QtlException.DimensionMismatch ("weights", numInd, weights.length);
	}

	private static void checkNoMissing (double[][] pheno) {
		for (int i = 0; i < pheno.length; i++) {
			for (double value : pheno[i]) {
				if (PhenotypeMatrix.isMissing (value)) throw new QtlException.DimensionMismatch ("missing phenotype of individual " + i + ", omit it before the scan");
			}
		}
	}
}
