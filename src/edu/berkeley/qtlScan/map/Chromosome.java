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

public class Chromosome {

	private final String name;
	private final boolean sexChromosome;

	public Chromosome (String name, boolean sexChromosome) {
		this.name = name;
		this.sexChromosome = sexChromosome;
	}

	// X and Y are sex chromosomes, everything else an autosome
	public static Chromosome fromName (String name) {
		String trimmed = name.trim();
		boolean sex = trimmed.equalsIgnoreCase ("X") || trimmed.equalsIgnoreCase ("Y");
		return new Chromosome (trimmed, sex);
	}

	public String getName () {
		return this.name;
	}

	public boolean isSexChromosome () {
		return this.sexChromosome;
	}

	@Override
	public boolean equals (Object o) {
		if (o != null && this.getClass() == o.getClass()) {
			return this.name.equals (((Chromosome) o).name);
		}
		return false;
	}

	@Override
	public int hashCode () {
		return this.name.hashCode();
	}

	@Override
	public String toString () {
		return this.name;
	}
}
