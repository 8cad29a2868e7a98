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

package edu.berkeley.qtlScan.genotype;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.berkeley.qtlScan.exceptions.QtlException;

// individuals x markers, every cell a reference to a registered symbol
public class GenotypeMatrix {

	private final GenotypeSymbolMapper[][] cells;
	private final List<String> markerNames;
	private final Map<String, Integer> markerIdxMap = new HashMap<String, Integer>();

	public GenotypeMatrix (GenotypeSymbolMapper[][] cells, List<String> markerNames) {
		for (int i = 0; i < cells.length; i++) {
			if (cells[i].length != markerNames.size()) throw new QtlException.DimensionMismatch ("genotype columns of individual " + i, markerNames.size(), cells[i].length);
		}
		this.cells = cells;
		this.markerNames = new ArrayList<String>(markerNames);
		for (int m = 0; m < this.markerNames.size(); m++) {
			this.markerIdxMap.put (this.markerNames.get(m), m);
		}
	}

	// decode a matrix of raw genotype calls
	public static GenotypeMatrix decode (String[][] rawCalls, List<String> markerNames, ObservedGenotypeRegistry registry) {
		GenotypeSymbolMapper[][] cells = new GenotypeSymbolMapper[rawCalls.length][];
		for (int i = 0; i < rawCalls.length; i++) {
			cells[i] = new GenotypeSymbolMapper[rawCalls[i].length];
			for (int m = 0; m < rawCalls[i].length; m++) {
				cells[i][m] = registry.decode (rawCalls[i][m]);
			}
		}
		return new GenotypeMatrix (cells, markerNames);
	}

	public GenotypeSymbolMapper get (int individual, int marker) {
		return this.cells[individual][marker];
	}

	public GenotypeSymbolMapper[] getIndividual (int individual) {
		return this.cells[individual];
	}

	// -1 if there is no such column
	public int markerIndex (String markerName) {
		Integer idx = this.markerIdxMap.get (markerName);
		return idx == null ? -1 : idx;
	}

	public List<String> getMarkerNames () {
		return Collections.unmodifiableList (this.markerNames);
	}

	public int numIndividuals () {
		return this.cells.length;
	}

	public int numMarkers () {
		return this.markerNames.size();
	}

	// keeps the rows not flagged, cells still point to the same symbols
	public GenotypeMatrix omitIndividuals (boolean[] toOmit) {
		if (toOmit.length != this.cells.length) throw new QtlException.DimensionMismatch ("individuals to omit from genotypes", this.cells.length, toOmit.length);

		List<GenotypeSymbolMapper[]> kept = new ArrayList<GenotypeSymbolMapper[]>();
		for (int i = 0; i < this.cells.length; i++) {
			if (!toOmit[i]) kept.add (this.cells[i]);
		}
		return new GenotypeMatrix (kept.toArray (new GenotypeSymbolMapper[0][]), this.markerNames);
	}
}
