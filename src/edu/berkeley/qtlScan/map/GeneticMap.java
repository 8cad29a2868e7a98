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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.util.MathArrays;

// markers split by chromosome, each chromosome sorted by map position
public class GeneticMap {

	private final Map<Chromosome, List<Marker>> markersByChromosome;

	private GeneticMap (Map<Chromosome, List<Marker>> markersByChromosome) {
		this.markersByChromosome = markersByChromosome;
	}

	// chromosomes in order of first appearance, positions sorted (stable for ties)
	public static GeneticMap fromMarkers (List<Marker> markers) {
		Map<Chromosome, List<Marker>> byChromosome = new LinkedHashMap<Chromosome, List<Marker>>();
		for (Marker marker : markers) {
			List<Marker> chrMarkers = byChromosome.get (marker.getChromosome());
			if (chrMarkers == null) {
				chrMarkers = new ArrayList<Marker>();
				byChromosome.put (marker.getChromosome(), chrMarkers);
			}
			chrMarkers.add (marker);
		}
		for (List<Marker> chrMarkers : byChromosome.values()) {
			chrMarkers.sort (Marker.BY_POSITION);
		}
		return new GeneticMap (byChromosome);
	}

	public static GeneticMap fromChromosomeMap (Map<Chromosome, List<Marker>> markersByChromosome) {
		Map<Chromosome, List<Marker>> copy = new LinkedHashMap<Chromosome, List<Marker>>();
		for (Map.Entry<Chromosome, List<Marker>> entry : markersByChromosome.entrySet()) {
			checkPositions (entry.getValue());
			copy.put (entry.getKey(), new ArrayList<Marker>(entry.getValue()));
		}
		return new GeneticMap (copy);
	}

	public List<Chromosome> getChromosomes () {
		return new ArrayList<Chromosome>(this.markersByChromosome.keySet());
	}

	public List<Marker> getMarkers (Chromosome chromosome) {
		List<Marker> chrMarkers = this.markersByChromosome.get (chromosome);
		if (chrMarkers == null) return Collections.emptyList();
		return Collections.unmodifiableList (chrMarkers);
	}

	public Map<Chromosome, List<Marker>> asMap () {
		return Collections.unmodifiableMap (this.markersByChromosome);
	}

	public int numChromosomes () {
		return this.markersByChromosome.size();
	}

	public int numPositions () {
		int total = 0;
		for (List<Marker> chrMarkers : this.markersByChromosome.values()) total += chrMarkers.size();
		return total;
	}

	public GeneticMap autosomesOnly () {
		Map<Chromosome, List<Marker>> autosomes = new LinkedHashMap<Chromosome, List<Marker>>();
		for (Map.Entry<Chromosome, List<Marker>> entry : this.markersByChromosome.entrySet()) {
			if (!entry.getKey().isSexChromosome()) autosomes.put (entry.getKey(), entry.getValue());
		}
		return new GeneticMap (autosomes);
	}

	// one chromosome, non-decreasing positions
	public static void checkPositions (List<Marker> positions) {
		if (positions.isEmpty()) return;
		Chromosome chromosome = positions.get(0).getChromosome();
		double[] values = new double[positions.size()];
		for (int k = 0; k < positions.size(); k++) {
			if (!positions.get(k).getChromosome().equals (chromosome)) {
				throw new IllegalArgumentException ("Marker " + positions.get(k) + " is not on chromosome " + chromosome);
			}
			values[k] = positions.get(k).getPosition();
		}
		MathArrays.checkOrder (values, MathArrays.OrderDirection.INCREASING, false);
	}

	// recombination fraction between each position and the next one
	public static double[] recombinationFractions (List<Marker> positions, MapFunction mapFunction) {
		checkPositions (positions);
		if (positions.size() < 2) return new double[0];

		double[] recFracs = new double[positions.size() - 1];
		for (int k = 0; k < recFracs.length; k++) {
			double distance = positions.get(k+1).getPosition() - positions.get(k).getPosition();
			recFracs[k] = mapFunction.recombinationFraction (distance);
		}
		return recFracs;
	}
}
