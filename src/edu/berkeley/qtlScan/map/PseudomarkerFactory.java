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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import gnu.trove.list.TDoubleList;
import gnu.trove.list.array.TDoubleArrayList;

// inserts scan positions without genotypes between the markers of a chromosome
public abstract class PseudomarkerFactory {

	// closer than this to a marker counts as the marker position
	public static final double POSITION_EPSILON = 1e-6;

	// candidate positions for one chromosome, sorted, not yet checked against the markers
	protected abstract TDoubleList getCandidatePositions (List<Marker> chrMarkers, double spacing);

	public abstract String factoryType ();

	public static PseudomarkerFactory getPseudomarkerFactory (String factoryName) {
		String lowName = factoryName.trim().toLowerCase();
		if (lowName.equals ("stepped")) {
			return new SteppedFactory();
		}
		else if (lowName.equals ("minimal")) {
			return new MinimalFactory();
		}
		throw new IllegalArgumentException ("Unknown pseudomarker policy \"" + factoryName + "\" [stepped,minimal]");
	}

	// markers and pseudomarkers of one chromosome, in map order
	public List<Marker> addPseudomarkers (List<Marker> chrMarkers, double spacing) {
		if (!(spacing > 0d)) throw new IllegalArgumentException ("Pseudomarker spacing has to be positive, got " + spacing);
		GeneticMap.checkPositions (chrMarkers);
		if (chrMarkers.isEmpty()) return new ArrayList<Marker>();

		Chromosome chromosome = chrMarkers.get(0).getChromosome();
		TDoubleList candidates = this.getCandidatePositions (chrMarkers, spacing);

		// merge the two sorted lists, drop candidates sitting on a marker
		List<Marker> merged = new ArrayList<Marker>();
		int markerIdx = 0;
		for (int c = 0; c < candidates.size(); c++) {
			double pos = candidates.get(c);
			while (markerIdx < chrMarkers.size() && chrMarkers.get(markerIdx).getPosition() < pos - POSITION_EPSILON) {
				merged.add (chrMarkers.get(markerIdx++));
			}
			if (markerIdx < chrMarkers.size() && Math.abs (chrMarkers.get(markerIdx).getPosition() - pos) <= POSITION_EPSILON) continue;
			if (!merged.isEmpty() && Math.abs (merged.get(merged.size()-1).getPosition() - pos) <= POSITION_EPSILON) continue;
			merged.add (Marker.pseudomarker (chromosome, pos));
		}
		while (markerIdx < chrMarkers.size()) merged.add (chrMarkers.get(markerIdx++));

		return merged;
	}

	public GeneticMap addPseudomarkers (GeneticMap map, double spacing) {
		Map<Chromosome, List<Marker>> withPseudo = new LinkedHashMap<Chromosome, List<Marker>>();
		for (Chromosome chromosome : map.getChromosomes()) {
			withPseudo.put (chromosome, this.addPseudomarkers (map.getMarkers (chromosome), spacing));
		}
		return GeneticMap.fromChromosomeMap (withPseudo);
	}

	@Override
	public String toString () {
		return this.factoryType();
	}

	// regular grid from the first marker on, whatever the marker density
	public static class SteppedFactory extends PseudomarkerFactory {
		@Override
		protected TDoubleList getCandidatePositions (List<Marker> chrMarkers, double spacing) {
			double start = chrMarkers.get(0).getPosition();
			double end = chrMarkers.get(chrMarkers.size()-1).getPosition();

			TDoubleList grid = new TDoubleArrayList();
			// count steps instead of adding up, so no rounding drift
			int numSteps = (int) Math.floor ((end - start) / spacing + POSITION_EPSILON);
			for (int k = 0; k <= numSteps; k++) {
				grid.add (start + k * spacing);
			}
			return grid;
		}

		@Override
		public String factoryType () {
			return "stepped";
		}
	}

	// only fill gaps wider than the spacing, with equally spaced points
	public static class MinimalFactory extends PseudomarkerFactory {
		@Override
		protected TDoubleList getCandidatePositions (List<Marker> chrMarkers, double spacing) {
			TDoubleList fill = new TDoubleArrayList();
			for (int m = 0; m + 1 < chrMarkers.size(); m++) {
				double left = chrMarkers.get(m).getPosition();
				double gap = chrMarkers.get(m+1).getPosition() - left;
				if (gap <= spacing + POSITION_EPSILON) continue;

				int numIntervals = (int) Math.ceil (gap / spacing - POSITION_EPSILON);
				double width = gap / numIntervals;
				for (int k = 1; k < numIntervals; k++) {
					fill.add (left + k * width);
				}
			}
			return fill;
		}

		@Override
		public String factoryType () {
			return "minimal";
		}
	}
}
