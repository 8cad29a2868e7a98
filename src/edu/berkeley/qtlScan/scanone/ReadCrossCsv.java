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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edu.berkeley.qtlScan.exceptions.QtlException;
import edu.berkeley.qtlScan.genotype.GenotypeMatrix;
import edu.berkeley.qtlScan.genotype.GenotypeSymbolMapper;
import edu.berkeley.qtlScan.genotype.ObservedGenotypeRegistry;
import edu.berkeley.qtlScan.map.Chromosome;
import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.phenotype.PhenotypeMatrix;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

// cross in the R/qtl csv layout: column names, chromosome per column (empty for phenotypes),
// marker positions in cM, then one line per individual. Phenotype columns with non-numeric
// values are left out and listed in CrossData.skippedPhenotypes.
public class ReadCrossCsv {

	public static final String SEPARATOR = ",";

	public static CrossData readCsv (File csvFile, ObservedGenotypeRegistry registry) throws IOException {
		Reader r = new FileReader (csvFile);
		try {
			return readCsv (r, csvFile.getName(), registry);
		}
		finally {
			r.close();
		}
	}

	public static CrossData readCsv (Reader r, String datasetName, ObservedGenotypeRegistry registry) throws IOException {
		BufferedReader bReader = new BufferedReader (r);

		String[] header = nextFields (bReader);
		String[] chrRow = nextFields (bReader);
		String[] posRow = nextFields (bReader);
		if (header == null || chrRow == null || posRow == null) throw new IOException ("Need a header, a chromosome and a position line in " + datasetName);
		if (chrRow.length != header.length) throw new IOException ("Chromosome line has " + chrRow.length + " fields, header has " + header.length);
		if (posRow.length > header.length) throw new IOException ("Position line has " + posRow.length + " fields, header has " + header.length);

		// which columns are phenotypes and which markers
		TIntList phenoColumns = new TIntArrayList();
		TIntList markerColumns = new TIntArrayList();
		List<String> phenoNames = new ArrayList<String>();
		List<String> markerNames = new ArrayList<String>();
		List<Marker> markers = new ArrayList<Marker>();
		Map<String, Chromosome> chromosomes = new HashMap<String, Chromosome>();
		for (int col = 0; col < header.length; col++) {
			if (chrRow[col].isEmpty()) {
				phenoColumns.add (col);
				phenoNames.add (header[col]);
				continue;
			}
			Chromosome chromosome = chromosomes.get (chrRow[col]);
			if (chromosome == null) {
				chromosome = Chromosome.fromName (chrRow[col]);
				chromosomes.put (chrRow[col], chromosome);
			}
			if (col >= posRow.length || posRow[col].isEmpty()) throw new IOException ("No map position for marker " + header[col] + " in " + datasetName);

			double position;
			try {
				position = Double.parseDouble (posRow[col]);
			}
			catch (NumberFormatException e) {
				throw new IOException ("Invalid map position \"" + posRow[col] + "\" for marker " + header[col] + " in " + datasetName);
			}
			markerColumns.add (col);
			markerNames.add (header[col]);
			markers.add (new Marker (header[col], chromosome, position));
		}
		if (markers.isEmpty()) throw new IOException ("No marker columns in " + datasetName);

		List<String[]> phenoCells = new ArrayList<String[]>();
		List<GenotypeSymbolMapper[]> genoRows = new ArrayList<GenotypeSymbolMapper[]>();
		boolean[] numeric = new boolean[phenoColumns.size()];
		Arrays.fill (numeric, true);
		String[] fields;
		int lineNumber = 3;
		while ((fields = nextFields (bReader)) != null) {
			lineNumber++;
			if (fields.length > header.length) throw new IOException ("Line " + lineNumber + " of " + datasetName + " has " + fields.length + " fields, header has " + header.length);

			String[] phenoRow = new String[phenoColumns.size()];
			for (int p = 0; p < phenoColumns.size(); p++) {
				phenoRow[p] = field (fields, phenoColumns.get(p));
				if (numeric[p] && !isNumeric (phenoRow[p])) numeric[p] = false;
			}

			GenotypeSymbolMapper[] genoRow = new GenotypeSymbolMapper[markerColumns.size()];
			for (int m = 0; m < markerColumns.size(); m++) {
				String call = field (fields, markerColumns.get(m));
				if (call.isEmpty()) {
					genoRow[m] = registry.getMissing();
					continue;
				}
				try {
					genoRow[m] = registry.decode (call);
				}
				catch (QtlException.UnresolvedSymbol e) {
					throw new QtlException.UnresolvedSymbol (call, datasetName + ", line " + lineNumber + ", marker " + markerNames.get(m));
				}
			}
			phenoCells.add (phenoRow);
			genoRows.add (genoRow);
		}

		// only numeric columns are phenotypes, the rest (sex, ids, ...) is set aside by name
		TIntList keptColumns = new TIntArrayList();
		List<String> keptNames = new ArrayList<String>();
		List<String> skippedNames = new ArrayList<String>();
		for (int p = 0; p < phenoNames.size(); p++) {
			if (numeric[p]) {
				keptColumns.add (p);
				keptNames.add (phenoNames.get(p));
			}
			else {
				skippedNames.add (phenoNames.get(p));
			}
		}
		if (!phenoNames.isEmpty() && keptNames.isEmpty()) throw new IOException ("No numeric phenotype column in " + datasetName + ", skipped " + skippedNames);

		double[][] phenoValues = new double[phenoCells.size()][keptColumns.size()];
		for (int i = 0; i < phenoCells.size(); i++) {
			for (int p = 0; p < keptColumns.size(); p++) {
				phenoValues[i][p] = PhenotypeMatrix.parseValue (phenoCells.get(i)[keptColumns.get(p)]);
			}
		}

		PhenotypeMatrix phenotypes = new PhenotypeMatrix (phenoValues, keptNames);
		GenotypeMatrix genotypes = new GenotypeMatrix (genoRows.toArray (new GenotypeSymbolMapper[0][]), markerNames);
		return new CrossData (datasetName, markers, genotypes, phenotypes, skippedNames);
	}

	private static boolean isNumeric (String value) {
		try {
			PhenotypeMatrix.parseValue (value);
			return true;
		}
		catch (NumberFormatException e) {
			return false;
		}
	}

	// null at the end, blank lines are skipped
	private static String[] nextFields (BufferedReader bReader) throws IOException {
		String line;
		while ((line = bReader.readLine()) != null) {
			if (line.trim().isEmpty()) continue;
			String[] fields = line.split (SEPARATOR, -1);
			for (int i = 0; i < fields.length; i++) fields[i] = unquote (fields[i].trim());
			return fields;
		}
		return null;
	}

	private static String unquote (String s) {
		if (s.length() >= 2 && s.startsWith ("\"") && s.endsWith ("\"")) return s.substring (1, s.length() - 1).trim();
		return s;
	}

	// short lines are padded with empty fields
	private static String field (String[] fields, int col) {
		return col < fields.length ? fields[col] : "";
	}
}
