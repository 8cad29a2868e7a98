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

package edu.berkeley.qtlScan.cross;

import org.testng.Assert;
import org.testng.annotations.Test;

import edu.berkeley.qtlScan.exceptions.QtlException;
import edu.berkeley.qtlScan.genotype.GenotypeSymbolMapper;
import edu.berkeley.qtlScan.genotype.ObservedGenotypeRegistry;
import edu.berkeley.qtlScan.genotype.TrueGenotype;
import edu.berkeley.qtlScan.utility.LogSum;

public class CrossModelTest {

	private static final double EPSILON = 1e-10;

	@Test
	public void testInitSumsToOne () {
		for (CrossType crossType : CrossType.values()) {
			CrossModel cross = new CrossModel (crossType);
			double[] logInit = new double[cross.numStates()];
			for (int s = 0; s < cross.numStates(); s++) logInit[s] = cross.initByState (s);
			Assert.assertEquals (Math.exp (LogSum.computeLogSum (logInit)), 1d, EPSILON, crossType.name());
		}
	}

	@Test
	public void testF2Init () {
		CrossModel f2 = new CrossModel (CrossType.F2);
		Assert.assertEquals (Math.exp (f2.init (new TrueGenotype (0, 0))), 0.25, EPSILON);
		Assert.assertEquals (Math.exp (f2.init (new TrueGenotype (1, 0))), 0.5, EPSILON);
		Assert.assertEquals (Math.exp (f2.init (new TrueGenotype (1, 1))), 0.25, EPSILON);
	}

	@Test
	public void testStepRowsSumToOne () {
		double[] recFracs = {0d, 1e-6, 0.01, 0.1, 0.25, 0.4999, 0.5};
		for (CrossType crossType : CrossType.values()) {
			CrossModel cross = new CrossModel (crossType);
			for (double r : recFracs) {
				for (int from = 0; from < cross.numStates(); from++) {
					double[] row = new double[cross.numStates()];
					for (int to = 0; to < cross.numStates(); to++) row[to] = cross.stepByState (from, to, r);
					Assert.assertEquals (Math.exp (LogSum.computeLogSum (row)), 1d, EPSILON, crossType + " r=" + r + " from " + from);
				}
			}
		}
	}

	@Test
	public void testNoRecombinationStaysPut () {
		for (CrossType crossType : CrossType.values()) {
			CrossModel cross = new CrossModel (crossType);
			for (int from = 0; from < cross.numStates(); from++) {
				for (int to = 0; to < cross.numStates(); to++) {
					double p = Math.exp (cross.stepByState (from, to, 0d));
					Assert.assertEquals (p, from == to ? 1d : 0d, EPSILON);
				}
			}
		}
	}

	@Test
	public void testRiMapExpansion () {
		double r = 0.1;
		CrossModel riself = new CrossModel (CrossType.RISELF);
		CrossModel risib = new CrossModel (CrossType.RISIB);
		Assert.assertEquals (Math.exp (riself.stepByState (0, 1, r)), 2 * r / (1 + 2 * r), EPSILON);
		Assert.assertEquals (Math.exp (risib.stepByState (0, 1, r)), 4 * r / (1 + 6 * r), EPSILON);
	}

	@Test
	public void testEmission () {
		CrossModel f2 = new CrossModel (CrossType.F2);
		ObservedGenotypeRegistry registry = f2.createSymbolRegistry();
		double e = 0.01;

		// fully informative call
		double[] a = f2.emitLogProbs (registry.decode ("A"), e);
		Assert.assertEquals (Math.exp (a[0]), 1 - e, EPSILON);
		Assert.assertEquals (Math.exp (a[1]), e / 2, EPSILON);
		Assert.assertEquals (Math.exp (a[2]), e / 2, EPSILON);

		// not BB: two of three states
		double[] d = f2.emitLogProbs (registry.decode ("D"), e);
		Assert.assertEquals (Math.exp (d[0]), 1 - e / 2, EPSILON);
		Assert.assertEquals (Math.exp (d[1]), 1 - e / 2, EPSILON);
		Assert.assertEquals (Math.exp (d[2]), e / 2, EPSILON);

		// missing carries no information
		for (double value : f2.emitLogProbs (registry.decode ("NA"), e)) Assert.assertEquals (value, 0d);
		for (double value : f2.emitLogProbs (null, e)) Assert.assertEquals (value, 0d);
	}

	@Test
	public void testBackcrossEmission () {
		CrossModel bc = new CrossModel (CrossType.BC);
		ObservedGenotypeRegistry registry = bc.createSymbolRegistry();
		Assert.assertEquals (Math.exp (bc.emit (registry.decode ("H"), new TrueGenotype (1, 0), 0.002)), 0.998, EPSILON);
		Assert.assertEquals (Math.exp (bc.emit (registry.decode ("H"), new TrueGenotype (0, 0), 0.002)), 0.002, EPSILON);
	}

	@Test(expectedExceptions = QtlException.IncompatibleCross.class)
	public void testEmissionOfImpossibleCall () {
		CrossModel bc = new CrossModel (CrossType.BC);
		bc.emitLogProbs (new GenotypeSymbolMapper ("B", true, new TrueGenotype (1, 1)), 0.01);
	}

	@Test(expectedExceptions = QtlException.IncompatibleCross.class)
	public void testInitOfImpossibleGenotype () {
		new CrossModel (CrossType.RISIB).init (new TrueGenotype (0, 1));
	}

	@Test(expectedExceptions = QtlException.IncompatibleCross.class)
	public void testCheckSymbols () {
		CrossModel ri = new CrossModel (CrossType.RISELF);
		ri.checkSymbols (new CrossModel (CrossType.F2).createSymbolRegistry());
	}

	@Test
	public void testF2RegistryDecodesHeterozygoteBothWays () {
		ObservedGenotypeRegistry registry = new CrossModel (CrossType.F2).createSymbolRegistry();
		Assert.assertSame (registry.decode ("0,1"), registry.decode ("H"));
		Assert.assertSame (registry.decode ("1,0"), registry.decode ("H"));
		Assert.assertEquals (registry.size(), 6);
	}

	@Test
	public void testCrossTypeFromString () {
		Assert.assertEquals (CrossType.fromString ("f2"), CrossType.F2);
		Assert.assertEquals (CrossType.fromString ("RIsib"), CrossType.RISIB);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testUnknownCrossType () {
		CrossType.fromString ("4way");
	}
}
