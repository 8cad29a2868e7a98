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

import edu.berkeley.qtlScan.map.Marker;

// maximum of the LOD curve of one phenotype on one chromosome
public class ScanPeak {

	private final int phenotypeIdx;
	private final double lod;
	private final Marker position;

	public ScanPeak (int phenotypeIdx, double lod, Marker position) {
		this.phenotypeIdx = phenotypeIdx;
		this.lod = lod;
		this.position = position;
	}

	public int getPhenotypeIdx () {
		return this.phenotypeIdx;
	}

	public double getLod () {
		return this.lod;
	}

	// null if the whole curve is NaN
	public Marker getPosition () {
		return this.position;
	}

	public boolean hasPosition () {
		return this.position != null;
	}

	@Override
	public String toString () {
		return "peak for phenotype " + this.phenotypeIdx + ": max lod = " + this.lod + " at pos = " + (this.position == null ? "NA" : this.position.getPosition());
	}
}
