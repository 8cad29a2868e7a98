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

import java.util.Arrays;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

public class PseudomarkerFactoryTest {

	private static final Chromosome CHR = Chromosome.fromName ("3");

	private static List<Marker> markers (double... positions) {
		Marker[] markers = new Marker[positions.length];
		for (int i = 0; i < positions.length; i++) markers[i] = new Marker ("m" + i, CHR, positions[i]);
		return Arrays.asList (markers);
	}

	private static double[] positions (List<Marker> markers) {
		double[] positions = new double[markers.size()];
		for (int i = 0; i < positions.length; i++) positions[i] = markers.get(i).getPosition();
		return positions;
	}

	@Test
	public void testMinimalFillsWideGaps () {
		PseudomarkerFactory minimal = PseudomarkerFactory.getPseudomarkerFactory ("minimal");
		List<Marker> result = minimal.addPseudomarkers (markers (0d, 1d, 7d), 2d);

		// gap of 6 gets two points, gap of 1 none
		Assert.assertEquals (positions (result), new double[] {0d, 1d, 3d, 5d, 7d}, 1e-9);
		Assert.assertFalse (result.get(1).isPseudomarker());
		Assert.assertTrue (result.get(2).isPseudomarker());
		Assert.assertEquals (result.get(2).getName(), "c3.loc3");
	}

	@Test
	public void testMinimalEqualSpacing () {
		PseudomarkerFactory minimal = PseudomarkerFactory.getPseudomarkerFactory ("minimal");
		List<Marker> result = minimal.addPseudomarkers (markers (0d, 5d), 2d);
		// ceil(5/2) = 3 intervals
		Assert.assertEquals (positions (result), new double[] {0d, 5d / 3, 10d / 3, 5d}, 1e-9);
	}

	@Test
	public void testSteppedGrid () {
		PseudomarkerFactory stepped = PseudomarkerFactory.getPseudomarkerFactory ("stepped");
		List<Marker> result = stepped.addPseudomarkers (markers (0d, 3d, 5d), 2d);
		// grid 0 2 4 plus the markers, 0 not duplicated
		Assert.assertEquals (positions (result), new double[] {0d, 2d, 3d, 4d, 5d}, 1e-9);
		Assert.assertEquals (result.size(), 5);
		Assert.assertFalse (result.get(0).isPseudomarker());
	}

	@Test
	public void testNoDuplicateOnMarker () {
		PseudomarkerFactory stepped = PseudomarkerFactory.getPseudomarkerFactory ("stepped");
		List<Marker> result = stepped.addPseudomarkers (markers (0d, 2d + 1e-8, 4d), 2d);
		Assert.assertEquals (result.size(), 3);
		for (Marker marker : result) Assert.assertFalse (marker.isPseudomarker());
	}

	@Test
	public void testSortedOutput () {
		for (String policy : new String[] {"stepped", "minimal"}) {
			List<Marker> result = PseudomarkerFactory.getPseudomarkerFactory (policy).addPseudomarkers (markers (1.3, 4.1, 4.1, 17.9, 30d), 2.5);
			GeneticMap.checkPositions (result);
			Assert.assertEquals (result.get(0).getPosition(), 1.3);
			Assert.assertEquals (result.get(result.size()-1).getPosition(), 30d);
		}
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testNonPositiveSpacing () {
		PseudomarkerFactory.getPseudomarkerFactory ("minimal").addPseudomarkers (markers (0d, 10d), 0d);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testUnknownPolicy () {
		PseudomarkerFactory.getPseudomarkerFactory ("dense");
	}
}
