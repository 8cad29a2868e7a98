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
import java.util.Collections;
import java.util.List;

import edu.berkeley.qtlScan.regression.ScanPeak;

// results of a whole genome scan, chromosomes in map order
public class ScanOneResult {

	public final List<ChromosomeScanResult> chromosomeResults;
	public final List<String> phenotypeNames;
	public final double[] rss0;
	public final int numIndividuals;

	public ScanOneResult (List<ChromosomeScanResult> chromosomeResults, List<String> phenotypeNames, double[] rss0, int numIndividuals) {
		this.chromosomeResults = Collections.unmodifiableList (chromosomeResults);
		this.phenotypeNames = Collections.unmodifiableList (phenotypeNames);
		this.rss0 = rss0;
		this.numIndividuals = numIndividuals;
	}

	public int numPhenotypes () {
		return this.phenotypeNames.size();
	}

	public static class ReportedPeak {
		public final ChromosomeScanResult chromosomeResult;
		public final ScanPeak peak;

		public ReportedPeak (ChromosomeScanResult chromosomeResult, ScanPeak peak) {
			this.chromosomeResult = chromosomeResult;
			this.peak = peak;
		}
	}

	// peaks with a position and LOD above the threshold, by chromosome, then phenotype
	public List<ReportedPeak> getPeaksAbove (double lodThreshold) {
		List<ReportedPeak> reported = new ArrayList<ReportedPeak>();
		for (ChromosomeScanResult chrResult : this.chromosomeResults) {
			for (ScanPeak peak : chrResult.peaks) {
				if (peak.hasPosition() && peak.getLod() > lodThreshold) reported.add (new ReportedPeak (chrResult, peak));
			}
		}
		return reported;
	}
}
