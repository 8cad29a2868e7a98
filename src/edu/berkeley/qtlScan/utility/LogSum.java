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

package edu.berkeley.qtlScan.utility;

// sums of numbers given by their logarithms, without leaving log space
public final class LogSum {
	private final double[] logSummandArray;
	private int currSize;

	private double maxLogSummand;

	public LogSum (int maxEntries) {
		this.logSummandArray = new double[maxEntries];

		reset();
	}

	public final void reset () {
		this.currSize = 0;
		this.maxLogSummand = Double.NEGATIVE_INFINITY;
	}

	public final void addLogSummand (double logSummand) {
		this.logSummandArray[currSize++] = logSummand;
		this.maxLogSummand = Math.max (this.maxLogSummand, logSummand);
	}

	public final double retrieveLogSum () {
		return computeLogSum (this.logSummandArray, this.currSize, this.maxLogSummand);
	}

	public final static double computeLogSum (double[] logSummands) {
		double maxLogSummand = Double.NEGATIVE_INFINITY;
		for (double value : logSummands) maxLogSummand = Math.max (maxLogSummand, value);
		return computeLogSum (logSummands, logSummands.length, maxLogSummand);
	}

	private static double computeLogSum (double[] logSummands, int size, double maxLogSummand) {
		// all zero, or nothing there
		if (maxLogSummand == Double.NEGATIVE_INFINITY) return Double.NEGATIVE_INFINITY;

		double factorSum = 0;
		for (int i = 0; i < size; i++) {
			factorSum += Math.exp (logSummands[i] - maxLogSummand);
		}

		return Math.log (factorSum) + maxLogSummand;
	}

	public final static double computePairLogSum (double ls1, double ls2) {
		double maxLogSummand = Math.max (ls1, ls2);
		if (maxLogSummand == Double.NEGATIVE_INFINITY) return Double.NEGATIVE_INFINITY;

		double factorSum = Math.exp (ls1 - maxLogSummand) + Math.exp (ls2 - maxLogSummand);
		return Math.log (factorSum) + maxLogSummand;
	}

	// turns a vector of log weights into probabilities summing to one
	public final static double[] logNormalize (double[] logValues) {
		double logTotal = computeLogSum (logValues);
		assert (logTotal != Double.NEGATIVE_INFINITY);

		double[] probs = new double[logValues.length];
		for (int i = 0; i < logValues.length; i++) {
			probs[i] = Math.exp (logValues[i] - logTotal);
		}
		return probs;
	}
}
