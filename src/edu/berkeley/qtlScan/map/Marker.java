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

import java.util.Comparator;
import java.util.Locale;

// a position on a chromosome, either a genotyped marker or an inserted pseudomarker
public class Marker {

	public static final Comparator<Marker> BY_POSITION = Comparator.comparingDouble (Marker::getPosition);

	private final String name;
	private final Chromosome chromosome;
	private final double position;
	private final boolean pseudomarker;

	public Marker (String name, Chromosome chromosome, double position) {
		this (name, chromosome, position, false);
	}

	private Marker (String name, Chromosome chromosome, double position, boolean pseudomarker) {
		this.name = name;
		this.chromosome = chromosome;
		this.position = position;
		this.pseudomarker = pseudomarker;
	}

	// named like "c1.loc12.5"
	public static Marker pseudomarker (Chromosome chromosome, double position) {
		String posString = String.format (Locale.US, "%.6f", position).replaceAll ("0+$", "").replaceAll ("\\.$", "");
		return new Marker ("c" + chromosome.getName() + ".loc" + posString, chromosome, position, true);
	}

	public String getName () {
		return this.name;
	}

	public Chromosome getChromosome () {
		return this.chromosome;
	}

	// in cM
	public double getPosition () {
		return this.position;
	}

	public boolean isPseudomarker () {
		return this.pseudomarker;
	}

	@Override
	public String toString () {
		return this.name + "[" + this.chromosome + ":" + this.position + "]";
	}
}
