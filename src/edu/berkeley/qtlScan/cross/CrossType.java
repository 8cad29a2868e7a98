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

// the experimental crosses we can handle
public enum CrossType {
	F2 ("A H B D C"),
	BC ("A H"),
	RISELF ("A B"),
	RISIB ("A B");

	public static final String DEFAULT_NA_IDS = "NA -";

	// observed symbols in the order the cross model expects them
	public final String defaultGenotypeIds;

	private CrossType (String defaultGenotypeIds) {
		this.defaultGenotypeIds = defaultGenotypeIds;
	}

	public static CrossType fromString (String name) {
		String trimmed = name.trim();
		for (CrossType type : CrossType.values()) {
			if (type.name().equalsIgnoreCase (trimmed)) return type;
		}
		throw new IllegalArgumentException ("Unknown cross type \"" + name + "\", has to be one of F2, BC, RISELF, RISIB.");
	}
}
