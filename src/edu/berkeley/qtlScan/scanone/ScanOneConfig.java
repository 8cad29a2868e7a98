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

import java.util.ArrayList;
import java.util.List;

import edu.berkeley.qtlScan.exceptions.QtlException;
import edu.berkeley.qtlScan.map.MapFunction;
import edu.berkeley.qtlScan.map.PseudomarkerFactory;
import gnu.trove.list.TDoubleList;
import gnu.trove.list.array.TDoubleArrayList;

// settings of one genome scan
public class ScanOneConfig {

	public static final double DEFAULT_STEP = 2d;
	public static final double DEFAULT_ERROR_PROB = 0.002d;
	public static final double DEFAULT_LOD_THRESHOLD = 2d;

	public final MapFunction mapFunction;
	public final PseudomarkerFactory pseudomarkerFactory;
	public final double step;
	public final double errorProb;
	public final double lodThreshold;
	// null means no parallel threads
	public final Integer parallelThreads;
	public final boolean includeSexChromosomes;
	public final boolean verbose;

	// [individual][covariate], null for none
	public final double[][] addcovar;
	public final double[][] intcovar;
	public final double[] weights;

	public ScanOneConfig (MapFunction mapFunction, PseudomarkerFactory pseudomarkerFactory, double step, double errorProb, double lodThreshold,
			Integer parallelThreads, boolean includeSexChromosomes, boolean verbose) {
		this (mapFunction, pseudomarkerFactory, step, errorProb, lodThreshold, parallelThreads, includeSexChromosomes, verbose, null, null, null);
	}

	public ScanOneConfig (MapFunction mapFunction, PseudomarkerFactory pseudomarkerFactory, double step, double errorProb, double lodThreshold,
			Integer parallelThreads, boolean includeSexChromosomes, boolean verbose, double[][] addcovar, double[][] intcovar, double[] weights) {
		if (!(step > 0d)) throw new IllegalArgumentException ("Step has to be positive, got " + step);
		if (!(errorProb > 0d && errorProb < 1d)) throw new IllegalArgumentException ("Genotyping error probability has to be in (0,1), got " + errorProb);
		if (parallelThreads != null && parallelThreads < 1) throw new IllegalArgumentException ("Need a positive number of parallel threads (Not " + parallelThreads + ").");
		this.mapFunction = mapFunction;
		this.pseudomarkerFactory = pseudomarkerFactory;
		this.step = step;
		this.errorProb = errorProb;
		this.lodThreshold = lodThreshold;
		this.parallelThreads = parallelThreads;
		this.includeSexChromosomes = includeSexChromosomes;
		this.verbose = verbose;
		this.addcovar = addcovar;
		this.intcovar = intcovar;
		this.weights = weights;
	}

	public static ScanOneConfig defaultConfig () {
		return new ScanOneConfig (new MapFunction.Haldane(), new PseudomarkerFactory.MinimalFactory(), DEFAULT_STEP, DEFAULT_ERROR_PROB, DEFAULT_LOD_THRESHOLD, null, false, false);
	}

	// covariate and weight rows of the individuals not flagged
	public ScanOneConfig omitIndividuals (boolean[] toOmit) {
		return new ScanOneConfig (this.mapFunction, this.pseudomarkerFactory, this.step, this.errorProb, this.lodThreshold, this.parallelThreads,
				this.includeSexChromosomes, this.verbose, omitRows (this.addcovar, toOmit), omitRows (this.intcovar, toOmit), omitEntries (this.weights, toOmit));
	}

	private static double[][] omitRows (double[][] matrix, boolean[] toOmit) {
		if (matrix == null || matrix.length == 0) return matrix;
		if (matrix.length != toOmit.length) throw new QtlException.DimensionMismatch ("covariate rows", toOmit.length, matrix.length);
		List<double[]> kept = new ArrayList<double[]>();
		for (int i = 0; i < matrix.length; i++) {
			if (!toOmit[i]) kept.add (matrix[i]);
		}
		return kept.toArray (new double[0][]);
	}

	private static double[] omitEntries (double[] values, boolean[] toOmit) {
		if (values == null || values.length == 0) return values;
		if (values.length != toOmit.length) throw new QtlException.DimensionMismatch ("weights", toOmit.length, values.length);
		TDoubleList kept = new TDoubleArrayList();
		for (int i = 0; i < values.length; i++) {
			if (!toOmit[i]) kept.add (values[i]);
		}
		return kept.toArray();
	}

	public boolean hasCovariates () {
		return (this.addcovar != null && this.addcovar.length > 0) || (this.intcovar != null && this.intcovar.length > 0);
	}
}
