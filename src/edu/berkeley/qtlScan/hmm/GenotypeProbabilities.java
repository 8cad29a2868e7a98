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

import java.util.Collections;
import java.util.List;

import edu.berkeley.qtlScan.genotype.TrueGenotype;
import edu.berkeley.qtlScan.map.Marker;

// [individual][position][state], states in cross model order
public class GenotypeProbabilities {

	private final double[][][] probs;
	private final List<Marker> positions;
	private final List<TrueGenotype> states;

	public GenotypeProbabilities (double[][][] probs, List<Marker> positions, List<TrueGenotype> states) {
		this.probs = probs;
		this.positions = Collections.unmodifiableList (positions);
		this.states = Collections.unmodifiableList (states);
	}

	public double get (int individual, int position, int state) {
		return this.probs[individual][position][state];
	}

	public double[] getStateProbs (int individual, int position) {
		return this.probs[individual][position];
	}

	public List<Marker> getPositions () {
		return this.positions;
	}

	public List<TrueGenotype> getStates () {
		return this.states;
	}

	public int numIndividuals () {
		return this.probs.length;
	}

	public int numPositions () {
		return this.positions.size();
	}

	public int numStates () {
		return this.states.size();
	}
}
