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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

import edu.berkeley.qtlScan.map.Chromosome;
import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.regression.ScanPeak;
import gnu.trove.list.array.TIntArrayList;

public class ScanReportTest {

	private static ScanOneResult smallResult () {
		Chromosome chr = Chromosome.fromName ("7");
		Marker m1 = new Marker ("D7M1", chr, 0d);
		Marker pseudo = Marker.pseudomarker (chr, 2.5);
		double[][] lod = { {0.5, Double.NaN}, {3.25, Double.NaN} };
		ScanPeak[] peaks = { new ScanPeak (0, 3.25, pseudo), new ScanPeak (1, Double.NaN, null) };
		ChromosomeScanResult chrResult = new ChromosomeScanResult (0, chr, Arrays.asList (m1, pseudo), lod, peaks, new TIntArrayList());
		return new ScanOneResult (Arrays.asList (chrResult), Arrays.asList ("T264", "sex"), new double[] {1d, 1d}, 10);
	}

	private static String[] lines (ByteArrayOutputStream bytes) {
		return bytes.toString().trim().split ("\\r?\\n");
	}

	@Test
	public void testPeakLine () {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		ScanReport.printPeaks (smallResult(), 2d, new PrintStream (bytes));
		String[] lines = lines (bytes);
		Assert.assertEquals (lines.length, 2);
		Assert.assertTrue (lines[0].startsWith ("# "));
		Assert.assertEquals (lines[1], "Chr 7  : peak for phenotype 0: max lod =    3.25 at pos =    2.50");
	}

	@Test
	public void testLodTable () {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		ScanReport.writeLodTable (smallResult(), new PrintStream (bytes));
		String[] lines = lines (bytes);
		Assert.assertEquals (lines[0], "chr\tmarker\tpos\tT264\tsex");
		Assert.assertEquals (lines[2], "7\tc7.loc2.5\t2.500000\t3.250000\tNA");
	}

	@Test
	public void testPeakTable () {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		ScanReport.writePeakTable (smallResult(), new PrintStream (bytes));
		String[] lines = lines (bytes);
		Assert.assertEquals (lines.length, 3);
		Assert.assertEquals (lines[1], "7\tT264\t3.250000\tc7.loc2.5\t2.500000");
		Assert.assertEquals (lines[2], "7\tsex\tNA\tNA\tNA");
	}
}
