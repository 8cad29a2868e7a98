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

package edu.berkeley.qtlScan.phenotype;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.berkeley.qtlScan.exceptions.QtlException;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

// individuals x phenotypes, missing values are exactly NA
public class PhenotypeMatrix {

	public static final double NA = Double.MAX_VALUE;

	private final double[][] values;
	private final List<String> phenotypeNames;

	public PhenotypeMatrix (double[][] values, List<String> phenotypeNames) {
		for (int i = 0; i < values.length; i++) {
			if (values[i].length != phenotypeNames.size()) throw new QtlException.DimensionMismatch ("phenotype columns of individual " + i, phenotypeNames.size(), values[i].length);
		}
		this.values = values;
		this.phenotypeNames = new ArrayList<String>(phenotypeNames);
	}

	public static double parseValue (String s) {
		String trimmed = s.trim();
		if (trimmed.isEmpty() || trimmed.equals ("NA") || trimmed.equals ("-")) return NA;
		return Double.parseDouble (trimmed);
	}

	public static boolean isMissing (double value) {
		return value == NA;
	}

	public double get (int individual, int phenotype) {
		return this.values[individual][phenotype];
	}

	public double[] getColumn (int phenotype) {
		double[] column = new double[this.values.length];
		for (int i = 0; i < this.values.length; i++) column[i] = this.values[i][phenotype];
		return column;
	}

	// copy, [individual][phenotype]
	public double[][] getValues () {
		double[][] copy = new double[this.values.length][];
		for (int i = 0; i < this.values.length; i++) copy[i] = this.values[i].clone();
		return copy;
	}

	public List<String> getPhenotypeNames () {
		return Collections.unmodifiableList (this.phenotypeNames);
	}

	public int numIndividuals () {
		return this.values.length;
	}

	public int numPhenotypes () {
		return this.phenotypeNames.size();
	}

	// true for every individual with at least one missing phenotype
	public boolean[] anyMissing () {
		boolean[] missing = new boolean[this.values.length];
		for (int i = 0; i < this.values.length; i++) {
			for (double value : this.values[i]) {
				if (isMissing (value)) {
					missing[i] = true;
					break;
				}
			}
		}
		return missing;
	}

	public boolean hasMissing () {
		for (boolean missing : this.anyMissing()) {
			if (missing) return true;
		}
		return false;
	}

	public PhenotypeMatrix omitIndividuals (boolean[] toOmit) {
		if (toOmit.length != this.values.length) throw new QtlException.DimensionMismatch ("individuals to omit from phenotypes", this.values.length, toOmit.length);

		TIntList keptIdxs = new TIntArrayList();
		for (int i = 0; i < this.values.length; i++) {
			if (!toOmit[i]) keptIdxs.add (i);
		}
		double[][] kept = new double[keptIdxs.size()][];
		for (int k = 0; k < keptIdxs.size(); k++) {
			kept[k] = this.values[keptIdxs.get(k)].clone();
		}
		return new PhenotypeMatrix (kept, this.phenotypeNames);
	}
}
