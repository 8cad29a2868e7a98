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

package edu.berkeley.qtlScan.utility;

import org.testng.Assert;
import org.testng.annotations.Test;

public class LogSumTest {

	@Test
	public void testLogSum () {
		double[] values = {0.1, 0.2, 0.7};
		LogSum logSum = new LogSum (values.length);
		for (double v : values) logSum.addLogSummand (Math.log (v));
		Assert.assertEquals (logSum.retrieveLogSum(), 0d, 1e-12);

		logSum.reset();
		Assert.assertEquals (logSum.retrieveLogSum(), Double.NEGATIVE_INFINITY);
	}

	@Test
	public void testLargeMagnitudes () {
		// would underflow outside log space
		double[] logValues = {-1000d, -1000d};
		Assert.assertEquals (LogSum.computeLogSum (logValues), -1000d + Math.log (2d), 1e-9);
		Assert.assertEquals (LogSum.computePairLogSum (-1000d, Double.NEGATIVE_INFINITY), -1000d, 1e-12);
	}

	@Test
	public void testLogNormalize () {
		double[] probs = LogSum.logNormalize (new double[] {Math.log (2d), Math.log (6d), Double.NEGATIVE_INFINITY});
		Assert.assertEquals (probs[0], 0.25, 1e-12);
		Assert.assertEquals (probs[1], 0.75, 1e-12);
		Assert.assertEquals (probs[2], 0d);
	}
}
