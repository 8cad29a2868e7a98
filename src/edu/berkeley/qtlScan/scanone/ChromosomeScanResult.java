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

import java.util.List;

import edu.berkeley.qtlScan.map.Chromosome;
import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.regression.ScanPeak;
import gnu.trove.list.TIntList;

// LOD curve of all phenotypes along one chromosome
public class ChromosomeScanResult {

	public final int chromosomeIdx;
	public final Chromosome chromosome;
	public final List<Marker> positions;
	// [position][phenotype]
	public final double[][] lod;
	public final ScanPeak[] peaks;
	// positions where the regression was rank deficient, their LOD is NaN
	public final TIntList degeneratePositions;

	public ChromosomeScanResult (int chromosomeIdx, Chromosome chromosome, List<Marker> positions, double[][] lod, ScanPeak[] peaks, TIntList degeneratePositions) {
		this.chromosomeIdx = chromosomeIdx;
		this.chromosome = chromosome;
		this.positions = positions;
		this.lod = lod;
		this.peaks = peaks;
		this.degeneratePositions = degeneratePositions;
	}
}
