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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.regression.ScanPeak;
import edu.berkeley.qtlScan.scanone.ScanOneResult.ReportedPeak;

// text output of a scan: peak lines on the console and tab separated tables
public class ScanReport {

	public static final String NA_STRING = "NA";

	public static String formatPeak (ReportedPeak reported) {
		ScanPeak peak = reported.peak;
		return String.format (Locale.US, "Chr %-2s : peak for phenotype %d: max lod = %7.2f at pos = %7.2f",
				reported.chromosomeResult.chromosome.getName(), peak.getPhenotypeIdx(), peak.getLod(), peak.getPosition().getPosition());
	}

	public static void printPeaks (ScanOneResult result, double lodThreshold, PrintStream outStream) {
		List<ReportedPeak> peaks = result.getPeaksAbove (lodThreshold);
		outStream.println ("# Peaks with LOD > " + lodThreshold + ": " + peaks.size());
		for (ReportedPeak reported : peaks) {
			outStream.println (formatPeak (reported));
		}
	}

	// chromosome, marker, position, then one LOD column per phenotype
	public static void writeLodTable (ScanOneResult result, PrintStream outStream) {
		StringBuilder header = new StringBuilder ("chr\tmarker\tpos");
		for (String name : result.phenotypeNames) header.append ("\t").append (name);
		outStream.println (header);

		for (ChromosomeScanResult chrResult : result.chromosomeResults) {
			for (int pos = 0; pos < chrResult.positions.size(); pos++) {
				Marker marker = chrResult.positions.get(pos);
				StringBuilder line = new StringBuilder();
				line.append (chrResult.chromosome.getName()).append ("\t").append (marker.getName()).append ("\t").append (formatNumber (marker.getPosition()));
				for (double lod : chrResult.lod[pos]) line.append ("\t").append (formatNumber (lod));
				outStream.println (line);
			}
		}
	}

	// every peak, whatever its LOD
	public static void writePeakTable (ScanOneResult result, PrintStream outStream) {
		outStream.println ("chr\tphenotype\tlod\tmarker\tpos");
		for (ChromosomeScanResult chrResult : result.chromosomeResults) {
			for (ScanPeak peak : chrResult.peaks) {
				String marker = peak.hasPosition() ? peak.getPosition().getName() : NA_STRING;
				String pos = peak.hasPosition() ? formatNumber (peak.getPosition().getPosition()) : NA_STRING;
				outStream.println (chrResult.chromosome.getName() + "\t" + result.phenotypeNames.get (peak.getPhenotypeIdx()) + "\t" + formatNumber (peak.getLod()) + "\t" + marker + "\t" + pos);
			}
		}
	}

	public static void writeLodTable (ScanOneResult result, File file) throws IOException {
		PrintStream outStream = new PrintStream (file, "UTF-8");
		try {
			writeLodTable (result, outStream);
		}
		finally {
			outStream.close();
		}
	}

	public static void writePeakTable (ScanOneResult result, File file) throws IOException {
		PrintStream outStream = new PrintStream (file, "UTF-8");
		try {
			writePeakTable (result, outStream);
		}
		finally {
			outStream.close();
		}
	}

	static String formatNumber (double value) {
		if (Double.isNaN (value)) return NA_STRING;
		return String.format (Locale.US, "%.6f", value);
	}
}
