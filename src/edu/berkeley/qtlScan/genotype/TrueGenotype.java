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

// one concrete diploid genotype, given as the founder index of each allele
public final class TrueGenotype implements Comparable<TrueGenotype> {

	private final int first;
	private final int second;

	public TrueGenotype (int first, int second) {
		if (first < 0 || second < 0) throw new IllegalArgumentException ("Founder indices have to be non-negative: " + first + "," + second);
		this.first = first;
		this.second = second;
	}

	// reads "a,b"; the unknown markers NA, - and "" are no true genotypes
	public static TrueGenotype parse (String str) {
		String trimmed = str.trim();
		if (ObservedGenotypeRegistry.isUnknownLiteral (trimmed)) {
			throw new IllegalArgumentException ("Can not initialize genotype field with value \"" + str + "\"");
		}
		String[] fields = trimmed.split (",");
		if (fields.length != 2) {
			throw new IllegalArgumentException ("Can not parse true genotype field with value \"" + str + "\"");
		}
		// NumberFormatException is an IllegalArgumentException as well
		return new TrueGenotype (Integer.parseInt (fields[0].trim()), Integer.parseInt (fields[1].trim()));
	}

	public int getFirst () {
		return this.first;
	}

	public int getSecond () {
		return this.second;
	}

	public int getAllele (int alleleIdx) {
		return alleleIdx == 0 ? this.first : this.second;
	}

	public boolean isHomozygous () {
		return this.first == this.second;
	}

	public boolean isHeterozygous () {
		return !this.isHomozygous();
	}

	public TrueGenotype reversed () {
		return new TrueGenotype (this.second, this.first);
	}

	// first founder major, second minor
	public int compareTo (TrueGenotype other) {
		int res = Integer.compare (this.first, other.first);
		if (res == 0) res = Integer.compare (this.second, other.second);
		return res;
	}

	@Override
	public boolean equals (Object o) {
		if (o != null && this.getClass() == o.getClass()) {
			TrueGenotype other = (TrueGenotype) o;
			return this.first == other.first && this.second == other.second;
		}
		return false;
	}

	@Override
	public int hashCode () {
		return (this.first * 0x1f1f1f1f) ^ this.second;
	}

	// short form, e.g. "1,0"
	public String toTrueGenotypeString () {
		return this.first + "," + this.second;
	}

	@Override
	public String toString () {
		return "(" + this.toTrueGenotypeString() + ")";
	}
}
