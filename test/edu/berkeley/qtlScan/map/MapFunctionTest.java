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

import org.testng.Assert;
import org.testng.annotations.Test;

public class MapFunctionTest {

	private static final double EPSILON = 1e-9;

	@Test
	public void testHaldane () {
		MapFunction haldane = MapFunction.getMapFunction ("haldane");
		Assert.assertEquals (haldane.recombinationFraction (0d), 0d, EPSILON);
		Assert.assertEquals (haldane.recombinationFraction (10d), 0.5 * (1 - Math.exp (-0.2)), EPSILON);
		Assert.assertEquals (haldane.recombinationFraction (1e6), 0.5, EPSILON);
	}

	@Test
	public void testKosambi () {
		MapFunction kosambi = MapFunction.getMapFunction ("Kosambi");
		Assert.assertEquals (kosambi.recombinationFraction (10d), 0.5 * Math.tanh (0.2), EPSILON);
	}

	@Test
	public void testMorganIsCapped () {
		MapFunction morgan = MapFunction.getMapFunction ("morgan");
		Assert.assertEquals (morgan.recombinationFraction (20d), 0.2, EPSILON);
		Assert.assertEquals (morgan.recombinationFraction (80d), 0.5, EPSILON);
	}

	@Test
	public void testRoundTrips () {
		String[] names = {"haldane", "kosambi", "c-f", "morgan"};
		double[] distances = {0.5, 2d, 10d, 35d};
		for (String name : names) {
			MapFunction mapFunction = MapFunction.getMapFunction (name);
			for (double d : distances) {
				double r = mapFunction.recombinationFraction (d);
				Assert.assertTrue (r >= 0d && r <= 0.5, name + " " + d);
				Assert.assertEquals (mapFunction.distance (r), d, 1e-6, name + " " + d);
			}
		}
	}

	@Test
	public void testInterferenceOrdering () {
		// more interference, fewer double crossovers, so r closer to d
		MapFunction cf = MapFunction.getMapFunction ("carter-falconer");
		MapFunction kosambi = MapFunction.getMapFunction ("kosambi");
		MapFunction haldane = MapFunction.getMapFunction ("haldane");
		Assert.assertTrue (haldane.recombinationFraction (20d) < kosambi.recombinationFraction (20d));
		Assert.assertTrue (kosambi.recombinationFraction (20d) < cf.recombinationFraction (20d));
		Assert.assertTrue (cf.recombinationFraction (20d) < 0.2);
		Assert.assertEquals (cf.recombinationFraction (0d), 0d);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testUnknownMapFunction () {
		MapFunction.getMapFunction ("foo");
	}
}
