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

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Parameter;
import com.martiansoftware.jsap.SimpleJSAP;
import com.martiansoftware.jsap.Switch;

import edu.berkeley.qtlScan.cross.CrossModel;
import edu.berkeley.qtlScan.cross.CrossType;
import edu.berkeley.qtlScan.genotype.GenotypeEncodingReader;
import edu.berkeley.qtlScan.genotype.ObservedGenotypeRegistry;
import edu.berkeley.qtlScan.map.MapFunction;
import edu.berkeley.qtlScan.map.PseudomarkerFactory;

// command line parameters of the genome scan, parsed and turned into the objects the scan needs
public class ScanOneParamSet {

	public final JSAPResult jsapParams;
	// false if JSAP printed help or an error, there is nothing to run then
	public final boolean valid;

	public final File csvFile;
	public final CrossModel crossModel;
	public final ObservedGenotypeRegistry registry;
	public final ScanOneConfig config;
	public final File lodFile;
	public final File peakFile;

	public ScanOneParamSet (String[] args, PrintStream outStream) throws JSAPException, IOException {

		Parameter[] params = new Parameter[] {
				new FlaggedOption ("csvFile", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.REQUIRED, 'f', "csvFile",
						"File with markers, genotypes and phenotypes, in the R/qtl csv layout."),
				new FlaggedOption ("cross", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.REQUIRED, 'c', "cross",
						"Cross type [F2,BC,RISELF,RISIB]."),
				new FlaggedOption ("genotypeIds", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "genotypeIds",
						"Blank separated genotype codes, for F2 AA, AB, BB, not BB, not AA (default 'A H B D C'), for BC AA, AB ('A H'), for RI lines AA, BB ('A B')."),
				new FlaggedOption ("naIds", JSAP.STRING_PARSER, CrossType.DEFAULT_NA_IDS, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "naIds",
						"Blank separated codes for missing genotypes."),
				new FlaggedOption ("symbolFile", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "symbolFile",
						"File with lines 'GENOTYPE <codes> as <true genotypes>', replaces genotypeIds and naIds."),
				new FlaggedOption ("mapFunction", JSAP.STRING_PARSER, "haldane", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "mapFunction",
						"Map function [haldane,kosambi,c-f,morgan]."),
				new FlaggedOption ("step", JSAP.DOUBLE_PARSER, String.valueOf (ScanOneConfig.DEFAULT_STEP), JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "step",
						"Pseudomarker spacing in cM."),
				new FlaggedOption ("pseudomarkers", JSAP.STRING_PARSER, "minimal", JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "pseudomarkers",
						"Pseudomarker policy [minimal,stepped]."),
				new FlaggedOption ("errorProb", JSAP.DOUBLE_PARSER, String.valueOf (ScanOneConfig.DEFAULT_ERROR_PROB), JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "errorProb",
						"Genotyping error probability."),
				new FlaggedOption ("lodThreshold", JSAP.DOUBLE_PARSER, String.valueOf (ScanOneConfig.DEFAULT_LOD_THRESHOLD), JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "lodThreshold",
						"Only peaks above this LOD are printed."),
				new FlaggedOption ("parallel", JSAP.INTEGER_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "parallel",
						"Specifies number of parallel threads"),
				new Switch ("includeSexChromosomes", JSAP.NO_SHORTFLAG, "includeSexChromosomes",
						"If this switch is set, X and Y are scanned like autosomes."),
				new FlaggedOption ("lodFile", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "lodFile",
						"Write the LOD curves to this file."),
				new FlaggedOption ("peakFile", JSAP.STRING_PARSER, JSAP.NO_DEFAULT, JSAP.NOT_REQUIRED, JSAP.NO_SHORTFLAG, "peakFile",
						"Write all peaks to this file."),
				new Switch ("verbose", 'v', "verbose", "Verbose progress output.")
		};

		List<Parameter> paramList = new ArrayList<Parameter>();
		for (Parameter param : params) paramList.add (param);
		paramList.sort (Comparator.comparing (Parameter::getID));

		SimpleJSAP jsap = new SimpleJSAP (
				"ScanOne",
				"Single QTL genome scan by Haley-Knott regression",
				paramList.toArray (new Parameter[0])
				);

		this.jsapParams = jsap.parse (args);
		if (jsap.messagePrinted()) {
			this.valid = false;
			this.csvFile = null;
			this.crossModel = null;
			this.registry = null;
			this.config = null;
			this.lodFile = null;
			this.peakFile = null;
			return;
		}
		this.valid = true;

		outStream.println ("# Parameter values:");

		this.csvFile = new File (this.jsapParams.getString ("csvFile"));
		outStream.println ("# csvFile = " + this.csvFile);

		CrossType crossType;
		try {
			crossType = CrossType.fromString (this.jsapParams.getString ("cross"));
		}
		catch (IllegalArgumentException e) {
			throw new IOException (e.getMessage());
		}
		this.crossModel = new CrossModel (crossType);
		outStream.println ("# cross = " + crossType);

		// genotype symbols, from file or from the codes
		if (this.jsapParams.contains ("symbolFile")) {
			String symbolFile = this.jsapParams.getString ("symbolFile");
			Reader r = new FileReader (symbolFile);
			try {
				this.registry = GenotypeEncodingReader.readEncodings (r);
			}
			finally {
				r.close();
			}
			outStream.println ("# symbolFile = " + symbolFile);
		}
		else {
			String genotypeIds = this.jsapParams.contains ("genotypeIds") ? this.jsapParams.getString ("genotypeIds") : crossType.defaultGenotypeIds;
			String naIds = this.jsapParams.getString ("naIds");
			try {
				this.registry = this.crossModel.createSymbolRegistry (genotypeIds, naIds);
			}
			catch (IllegalArgumentException e) {
				throw new IOException ("Invalid --genotypeIds \"" + genotypeIds + "\" for cross " + crossType + ": " + e.getMessage());
			}
			outStream.println ("# genotypeIds = " + genotypeIds);
			outStream.println ("# naIds = " + naIds);
		}
		this.crossModel.checkSymbols (this.registry);
		outStream.println ("# symbols = " + this.registry);

		MapFunction mapFunction;
		PseudomarkerFactory pseudomarkerFactory;
		try {
			mapFunction = MapFunction.getMapFunction (this.jsapParams.getString ("mapFunction"));
			pseudomarkerFactory = PseudomarkerFactory.getPseudomarkerFactory (this.jsapParams.getString ("pseudomarkers"));
		}
		catch (IllegalArgumentException e) {
			throw new IOException (e.getMessage());
		}

		double step = this.jsapParams.getDouble ("step");
		double errorProb = this.jsapParams.getDouble ("errorProb");
		double lodThreshold = this.jsapParams.getDouble ("lodThreshold");
		boolean includeSex = this.jsapParams.getBoolean ("includeSexChromosomes");
		boolean verbose = this.jsapParams.getBoolean ("verbose");

		// default is no parallel
		Integer parallelThreads = null;
		if (this.jsapParams.contains ("parallel")) {
			parallelThreads = this.jsapParams.getInt ("parallel");
			if (parallelThreads < 1) throw new IOException ("Need to a positive number of parallel threads (Not " + parallelThreads + ").");
		}

		try {
			this.config = new ScanOneConfig (mapFunction, pseudomarkerFactory, step, errorProb, lodThreshold, parallelThreads, includeSex, verbose);
		}
		catch (IllegalArgumentException e) {
			throw new IOException (e.getMessage());
		}
		outStream.println ("# mapFunction = " + mapFunction);
		outStream.println ("# pseudomarkers = " + pseudomarkerFactory);
		outStream.println ("# step = " + step);
		outStream.println ("# errorProb = " + errorProb);
		outStream.println ("# lodThreshold = " + lodThreshold);
		outStream.println ("# parallel threads = " + parallelThreads);
		outStream.println ("# includeSexChromosomes = " + includeSex);

		this.lodFile = this.jsapParams.contains ("lodFile") ? new File (this.jsapParams.getString ("lodFile")) : null;
		this.peakFile = this.jsapParams.contains ("peakFile") ? new File (this.jsapParams.getString ("peakFile")) : null;
		outStream.println ("# lodFile = " + this.lodFile);
		outStream.println ("# peakFile = " + this.peakFile);
	}
}
