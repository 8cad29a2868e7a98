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

package edu.berkeley.qtlScan.genotype;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

// true genotypes a call is compatible with, plus its encodings (first one is the name).
// Shared by all matrix cells with the call, so equality is identity. Empty means missing.
public class GenotypeSymbolMapper {

	private final String name;
	private final List<String> encodings = new ArrayList<String>();
	private final List<TrueGenotype> genotypes = new ArrayList<TrueGenotype>();
	private final boolean phaseKnown;

	public GenotypeSymbolMapper (String name) {
		this (name, true);
	}

	public GenotypeSymbolMapper (String name, boolean phaseKnown) {
		this.name = name;
		this.phaseKnown = phaseKnown;
		this.addEncoding (name);
	}

	public GenotypeSymbolMapper (String name, boolean phaseKnown, TrueGenotype... genotypes) {
		this (name, phaseKnown);
		for (TrueGenotype g : genotypes) this.add (g);
	}

	public GenotypeSymbolMapper (List<String> names, List<TrueGenotype> genotypes, boolean phaseKnown) {
		this (names.get(0), phaseKnown);
		for (String alias : names.subList (1, names.size())) this.addEncoding (alias);
		for (TrueGenotype g : genotypes) this.add (g);
	}

	public void addEncoding (String code) {
		if (!this.encodings.contains (code)) this.encodings.add (code);
	}

	// store g unless an equal pair is there already; returns the stored instance
	public TrueGenotype add (TrueGenotype g) {
		for (TrueGenotype stored : this.genotypes) {
			if (stored.equals (g)) return stored;
		}
		this.genotypes.add (g);
		if (!this.phaseKnown) this.add (g.reversed());
		return g;
	}

	public void addAll (GenotypeSymbolMapper other) {
		for (TrueGenotype g : other.genotypes) this.add (g);
	}

	public boolean matches (TrueGenotype trueGenotype) {
		return this.genotypes.contains (trueGenotype);
	}

	public boolean matches (String code) {
		return this.encodings.contains (code);
	}

	// same set of true genotypes, regardless of order and names
	public boolean hasSameGenotypes (GenotypeSymbolMapper other) {
		return new TreeSet<TrueGenotype>(this.genotypes).equals (new TreeSet<TrueGenotype>(other.genotypes));
	}

	public String getName () {
		return this.name;
	}

	public String canonicalAlias () {
		return this.name;
	}

	public List<String> getEncodings () {
		return Collections.unmodifiableList (this.encodings);
	}

	public List<TrueGenotype> getGenotypes () {
		return Collections.unmodifiableList (this.genotypes);
	}

	public boolean isPhaseKnown () {
		return this.phaseKnown;
	}

	public int size () {
		return this.genotypes.size();
	}

	public boolean isMissing () {
		return this.genotypes.isEmpty();
	}

	// e.g. "A AA"
	public String toEncodingString () {
		return String.join (" ", this.encodings);
	}

	// e.g. "0,0 1,0"
	public String toTrueGenotypes () {
		if (this.isMissing()) return "None";
		List<String> parts = new ArrayList<String>();
		for (TrueGenotype g : this.genotypes) parts.add (g.toTrueGenotypeString());
		return String.join (" ", parts);
	}

	@Override
	public String toString () {
		if (this.isMissing()) return "[NA]";
		return this.genotypes.toString();
	}
}
