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

import edu.berkeley.qtlScan.exceptions.QtlException;

// genotype symbols of a dataset in registration order, read-only once the scan starts
public class ObservedGenotypeRegistry {

	public static final String NA_STRING = "NA";
	public static final String DASH_STRING = "-";

	private final List<GenotypeSymbolMapper> symbols = new ArrayList<GenotypeSymbolMapper>();

	// handed out for unknown literals if no missing symbol is registered
	private final GenotypeSymbolMapper builtinMissing;

	public ObservedGenotypeRegistry () {
		this.builtinMissing = new GenotypeSymbolMapper (NA_STRING);
		this.builtinMissing.addEncoding (DASH_STRING);
	}

	public static boolean isUnknownLiteral (String s) {
		return s.isEmpty() || s.equals (NA_STRING) || s.equals (DASH_STRING);
	}

	public GenotypeSymbolMapper register (GenotypeSymbolMapper symbol) {
		for (GenotypeSymbolMapper known : this.symbols) {
			if (known == symbol) return known;
		}
		// aliases have to be unique across the registry
		for (String alias : symbol.getEncodings()) {
			if (!symbol.isMissing() && isUnknownLiteral (alias.trim())) throw new QtlException.DuplicateSymbol (alias);
			for (GenotypeSymbolMapper known : this.symbols) {
				if (known.matches (alias)) throw new QtlException.DuplicateSymbol (alias, known.getName());
			}
		}
		this.symbols.add (symbol);
		return symbol;
	}

	public GenotypeSymbolMapper decode (String s) {
		String code = s.trim();

		// first by name or alias
		for (GenotypeSymbolMapper symbol : this.symbols) {
			if (symbol.matches (code)) return symbol;
		}

		// unknown values always decode to missing
		if (isUnknownLiteral (code)) return this.getMissing();

		// then by the true genotype itself
		TrueGenotype geno;
		try {
			geno = TrueGenotype.parse (code);
		}
		catch (IllegalArgumentException e) {
			throw new QtlException.UnresolvedSymbol (s);
		}
		for (GenotypeSymbolMapper symbol : this.symbols) {
			if (!symbol.isMissing() && symbol.matches (geno)) return symbol;
		}
		throw new QtlException.UnresolvedSymbol (s);
	}

	public GenotypeSymbolMapper getMissing () {
		for (GenotypeSymbolMapper symbol : this.symbols) {
			if (symbol.isMissing()) return symbol;
		}
		return this.builtinMissing;
	}

	public List<GenotypeSymbolMapper> getSymbols () {
		return Collections.unmodifiableList (this.symbols);
	}

	public int size () {
		return this.symbols.size();
	}

	@Override
	public String toString () {
		return this.symbols.toString();
	}

	// e.g. "NA -~A~B [[NA], [(0,0)], [(1,1)]]"
	public String toEncodingString () {
		List<String> parts = new ArrayList<String>();
		for (GenotypeSymbolMapper symbol : this.symbols) parts.add (symbol.toEncodingString());
		return String.join ("~", parts) + this.toString();
	}
}
