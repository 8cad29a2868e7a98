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

package edu.berkeley.qtlScan.scanone;

import java.util.Collections;
import java.util.List;

import edu.berkeley.qtlScan.exceptions.QtlException;
import edu.berkeley.qtlScan.genotype.GenotypeMatrix;
import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.phenotype.PhenotypeMatrix;

// everything read from one dataset: the markers, the genotype calls and the phenotypes of the same individuals
public class CrossData {

	public final String datasetName;
	public final List<Marker> markers;
	public final GenotypeMatrix genotypes;
	public final PhenotypeMatrix phenotypes;
	// non-numeric phenotype columns
	public final List<String> skippedPhenotypes;

	public CrossData (String datasetName, List<Marker> markers, GenotypeMatrix genotypes, PhenotypeMatrix phenotypes) {
		this (datasetName, markers, genotypes, phenotypes, Collections.<String>emptyList());
	}

	public CrossData (String datasetName, List<Marker> markers, GenotypeMatrix genotypes, PhenotypeMatrix phenotypes, List<String> skippedPhenotypes) {
		if (genotypes.numIndividuals() != phenotypes.numIndividuals()) {
			throw new QtlException.DimensionMismatch ("individuals in " + datasetName, genotypes.numIndividuals(), phenotypes.numIndividuals());
		}
		if (genotypes.numMarkers() != markers.size()) {
			throw new QtlException.DimensionMismatch ("markers in " + datasetName, markers.size(), genotypes.numMarkers());
		}
		this.datasetName = datasetName;
		this.markers = Collections.unmodifiableList (markers);
		this.genotypes = genotypes;
		this.phenotypes = phenotypes;
		this.skippedPhenotypes = Collections.unmodifiableList (skippedPhenotypes);
	}

	public int numIndividuals () {
		return this.genotypes.numIndividuals();
	}
}
