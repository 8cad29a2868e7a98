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

package edu.berkeley.qtlScan.map;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;

// converts genetic map distances (cM) into recombination fractions and back
public abstract class MapFunction {

	public static final double MAX_RECOMBINATION_FRACTION = 0.5d;

	// distances in cM
	public abstract double recombinationFraction (double distance);
	public abstract double distance (double recombinationFraction);

	public abstract String functionName ();

	protected static double toMorgans (double centiMorgans) {
		return centiMorgans / 100d;
	}

	public static MapFunction getMapFunction (String name) {
		String lowName = name.trim().toLowerCase();
		if (lowName.equals ("haldane")) {
			return new Haldane();
		}
		else if (lowName.equals ("kosambi")) {
			return new Kosambi();
		}
		else if (lowName.equals ("c-f") || lowName.equals ("carter-falconer")) {
			return new CarterFalconer();
		}
		else if (lowName.equals ("morgan")) {
			return new Morgan();
		}
		throw new IllegalArgumentException ("Unknown map function \"" + name + "\" [haldane,kosambi,c-f,morgan]");
	}

	@Override
	public String toString () {
		return this.functionName();
	}

	public static class Haldane extends MapFunction {
		@Override
		public double recombinationFraction (double distance) {
			return 0.5d * (1d - Math.exp (-2d * toMorgans (Math.abs (distance))));
		}

		@Override
		public double distance (double recombinationFraction) {
			return -50d * Math.log (1d - 2d * recombinationFraction);
		}

		@Override
		public String functionName () {
			return "haldane";
		}
	}

	public static class Kosambi extends MapFunction {
		@Override
		public double recombinationFraction (double distance) {
			return 0.5d * Math.tanh (2d * toMorgans (Math.abs (distance)));
		}

		@Override
		public double distance (double recombinationFraction) {
			return 25d * Math.log ((1d + 2d * recombinationFraction) / (1d - 2d * recombinationFraction));
		}

		@Override
		public String functionName () {
			return "kosambi";
		}
	}

	// no closed form in this direction, so the inverse is solved numerically
	public static class CarterFalconer extends MapFunction {
		private static final double SOLVER_ACCURACY = 1e-12;
		private static final int MAX_SOLVER_EVALUATIONS = 1000;

		@Override
		public double recombinationFraction (double distance) {
			final double morgans = toMorgans (Math.abs (distance));
			if (morgans == 0d) return 0d;

			double upper = MAX_RECOMBINATION_FRACTION - SOLVER_ACCURACY;
			if (toMorgans (this.distance (upper)) <= morgans) return MAX_RECOMBINATION_FRACTION;

			UnivariateFunction target = r -> toMorgans (this.distance (r)) - morgans;
			return new BrentSolver (SOLVER_ACCURACY).solve (MAX_SOLVER_EVALUATIONS, target, 0d, upper);
		}

		@Override
		public double distance (double recombinationFraction) {
			double r = recombinationFraction;
			return 25d * Math.atan (2d * r) + 12.5d * Math.log ((1d + 2d * r) / (1d - 2d * r));
		}

		@Override
		public String functionName () {
			return "c-f";
		}
	}

	// complete interference, r grows linearly up to 1/2
	public static class Morgan extends MapFunction {
		@Override
		public double recombinationFraction (double distance) {
			return Math.min (toMorgans (Math.abs (distance)), MAX_RECOMBINATION_FRACTION);
		}

		@Override
		public double distance (double recombinationFraction) {
			return 100d * recombinationFraction;
		}

		@Override
		public String functionName () {
			return "morgan";
		}
	}
}
