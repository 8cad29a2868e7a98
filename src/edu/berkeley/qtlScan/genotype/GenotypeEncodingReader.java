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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads genotype symbol definitions of the form
 *
 * <pre>
 * GENOTYPE NA,- as None
 * GENOTYPE A as 0,0
 * GENOTYPE B,BB as 1,1
 * GENOTYPE AC,CA as 0,2 2,0    # phase unknown
 * GENOTYPE AorB as 0,0 1,1
 * </pre>
 *
 * Names before "as" are the encodings (first one is the symbol name), the pairs after it the true genotypes.
 */
public class GenotypeEncodingReader {

	public static final String GENOTYPE_KEYWORD = "GENOTYPE";
	public static final String AS_KEYWORD = "as";
	public static final String NONE_KEYWORD = "None";
	public static final String COMMENT = "#";

	public static class EncodedGenotype {
		public final List<String> names;
		public final List<TrueGenotype> genotypes;

		public EncodedGenotype (List<String> names, List<TrueGenotype> genotypes) {
			this.names = names;
			this.genotypes = genotypes;
		}

		public GenotypeSymbolMapper toSymbol () {
			return new GenotypeSymbolMapper (this.names, this.genotypes, true);
		}
	}

	public static EncodedGenotype parseLine (String line) throws IOException {
		String[] tokens = line.trim().split ("\\s+");
		if (!tokens[0].equals (GENOTYPE_KEYWORD)) throw new IOException ("Expected " + GENOTYPE_KEYWORD + " for " + line);

		// names up to the "as"
		List<String> names = new ArrayList<String>();
		int tokenIdx = 1;
		for (; tokenIdx < tokens.length; tokenIdx++) {
			if (tokens[tokenIdx].equals (AS_KEYWORD)) break;
			for (String name : tokens[tokenIdx].split (",")) {
				if (!name.isEmpty()) names.add (name);
			}
		}
		if (tokenIdx >= tokens.length) throw new IOException ("Expected '" + AS_KEYWORD + "' for " + line);
		if (names.isEmpty()) throw new IOException ("No genotype name given in " + line);

		// and the true genotypes after it
		List<TrueGenotype> genotypes = new ArrayList<TrueGenotype>();
		for (tokenIdx++; tokenIdx < tokens.length; tokenIdx++) {
			String token = tokens[tokenIdx];
			if (token.startsWith (COMMENT) || token.equals (NONE_KEYWORD)) break;
			String[] alleles = token.split (",");
			if (alleles.length != 2) throw new IOException ("Malformed genotype in " + line);
			try {
				genotypes.add (new TrueGenotype (Integer.parseInt (alleles[0]), Integer.parseInt (alleles[1])));
			}
			catch (IllegalArgumentException e) {
				throw new IOException ("Malformed genotype in " + line, e);
			}
		}

		return new EncodedGenotype (names, genotypes);
	}

	public static ObservedGenotypeRegistry readEncodings (Reader r) throws IOException {
		BufferedReader bReader = new BufferedReader (r);
		ObservedGenotypeRegistry registry = new ObservedGenotypeRegistry();

		String line;
		while ((line = bReader.readLine()) != null) {
			String trimmed = line.trim();
			if (trimmed.isEmpty() || trimmed.startsWith (COMMENT)) continue;
			// duplicate names come back from the registry
			registry.register (parseLine (trimmed).toSymbol());
		}
		bReader.close();

		return registry;
	}
}
