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

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

import com.martiansoftware.jsap.JSAPException;

import edu.berkeley.qtlScan.cross.CrossModel;
import edu.berkeley.qtlScan.exceptions.QtlException;
import edu.berkeley.qtlScan.genotype.GenotypeMatrix;
import edu.berkeley.qtlScan.map.Chromosome;
import edu.berkeley.qtlScan.map.GeneticMap;
import edu.berkeley.qtlScan.map.Marker;
import edu.berkeley.qtlScan.phenotype.PhenotypeMatrix;
import edu.berkeley.qtlScan.regression.HaleyKnottRegression;

public class ScanOne {

	public static synchronized void synchronizedPrintln (PrintStream outStream, String debugString) {
		outStream.println (debugString);
	}

	public static void main (String[] args) throws JSAPException, IOException {

		long programStartTime = System.currentTimeMillis();

		// print out the command line arguments
		PrintStream outStream = System.out;
		outStream.print ("# Command-line arguments: ");
		for (String arg : args) {
			outStream.print (arg + " ");
		}
		outStream.print ("\n");

		ScanOneParamSet scanParams;
		try {
			scanParams = new ScanOneParamSet (args, outStream);
		}
		catch (IOException | QtlException e) {
			System.err.println (e.getMessage());
			System.exit (-1);
			return;
		}
		if (!scanParams.valid) {
			System.exit (1);
			return;
		}

		CrossData data;
		try {
			data = ReadCrossCsv.readCsv (scanParams.csvFile, scanParams.registry);
		}
		catch (QtlException e) {
			System.err.println (e.getMessage());
			System.exit (-1);
			return;
		}
		if (!data.skippedPhenotypes.isEmpty()) {
			outStream.println ("# [WARNING] skipping non-numeric phenotype column(s) " + data.skippedPhenotypes);
		}
		outStream.println ("# " + data.numIndividuals() + " individuals, " + data.markers.size() + " markers, " + data.phenotypes.numPhenotypes() + " phenotypes");

		ScanOneResult result;
		try {
			result = run (scanParams.crossModel, data.genotypes, data.phenotypes, data.markers, scanParams.config, data.datasetName, outStream);
		}
		catch (QtlException e) {
			System.err.println (e.getMessage());
			if (e.getCause() != null) e.getCause().printStackTrace (System.err);
			System.exit (-1);
			return;
		}

		ScanReport.printPeaks (result, scanParams.config.lodThreshold, outStream);
		if (scanParams.lodFile != null) ScanReport.writeLodTable (result, scanParams.lodFile);
		if (scanParams.peakFile != null) ScanReport.writePeakTable (result, scanParams.peakFile);

		long endTime = System.currentTimeMillis();
		outStream.println ("# Total time elapsed: " + (endTime - programStartTime) + " ms");
	}

	public static ScanOneResult run (CrossModel crossModel, GenotypeMatrix genotypes, PhenotypeMatrix phenotypes, List<Marker> markers, ScanOneConfig config) {
		return run (crossModel, genotypes, phenotypes, markers, config, "dataset", System.out);
	}

	public static ScanOneResult run (CrossModel crossModel, GenotypeMatrix genotypes, PhenotypeMatrix phenotypes, List<Marker> markers, ScanOneConfig config,
			String datasetName, PrintStream outStream) {
		if (genotypes.numIndividuals() != phenotypes.numIndividuals()) {
			throw new QtlException.DimensionMismatch ("individuals", genotypes.numIndividuals(), phenotypes.numIndividuals());
		}

		// same individuals go from both
		boolean[] toOmit = phenotypes.anyMissing();
		int numOmit = 0;
		for (boolean omit : toOmit) if (omit) numOmit++;
		outStream.println ("# Omitting " + numOmit + " individuals with missing phenotype");
		PhenotypeMatrix keptPheno = phenotypes.omitIndividuals (toOmit);
		GenotypeMatrix keptGeno = genotypes.omitIndividuals (toOmit);
		if (keptPheno.numIndividuals() != keptGeno.numIndividuals()) {
			throw new QtlException.DimensionMismatch ("individuals after omitting", keptPheno.numIndividuals(), keptGeno.numIndividuals());
		}
		double[][] pheno = keptPheno.getValues();
		ScanOneConfig keptConfig = config.omitIndividuals (toOmit);

		GeneticMap map = GeneticMap.fromMarkers (markers);
		if (!config.includeSexChromosomes) {
			GeneticMap autosomes = map.autosomesOnly();
			if (autosomes.numChromosomes() < map.numChromosomes()) {
				outStream.println ("# [WARNING] skipping " + (map.numChromosomes() - autosomes.numChromosomes()) + " sex chromosome(s).");
			}
			map = autosomes;
		}
		GeneticMap scanMap = config.pseudomarkerFactory.addPseudomarkers (map, config.step);
		outStream.println ("# " + scanMap.numChromosomes() + " chromosomes, " + scanMap.numPositions() + " scan positions");

		double[] rss0 = HaleyKnottRegression.nullRss (pheno, keptConfig.addcovar, keptConfig.weights);

		// parallel, if we want to
		ExecutorService taskExecutor = null;
		if (config.parallelThreads != null) {
			taskExecutor = new ForkJoinPool (config.parallelThreads);
		}

		List<Chromosome> chromosomes = scanMap.getChromosomes();
		List<Future<ChromosomeScanResult>> futures = new ArrayList<Future<ChromosomeScanResult>>();
		List<ChromosomeScanResult> results = new ArrayList<ChromosomeScanResult>();
		try {
			for (int c = 0; c < chromosomes.size(); c++) {
				Chromosome chromosome = chromosomes.get(c);
				ChromosomeScan scan = new ChromosomeScan (c, chromosome, scanMap.getMarkers (chromosome), crossModel, keptGeno, pheno, rss0, keptConfig, outStream);

				Future<ChromosomeScanResult> theFuture = null;
				if (taskExecutor != null) {
					theFuture = taskExecutor.submit (scan);
				}
				else {
					FutureTask<ChromosomeScanResult> futureTask = new FutureTask<ChromosomeScanResult> (scan);
					futureTask.run();
					theFuture = futureTask;
				}
				assert (theFuture != null);
				futures.add (theFuture);
			}

			// collect in chromosome order
			for (int c = 0; c < futures.size(); c++) {
				try {
					ChromosomeScanResult result = futures.get(c).get();
					assert (result.chromosomeIdx == c);
					results.add (result);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new QtlException.ChromosomeScanFailed (datasetName, chromosomes.get(c).getName(), e);
				}
				catch (ExecutionException e) {
					throw new QtlException.ChromosomeScanFailed (datasetName, chromosomes.get(c).getName(), e.getCause());
				}
			}
		}
		finally {
			if (taskExecutor != null) taskExecutor.shutdown();
		}

		return new ScanOneResult (results, keptPheno.getPhenotypeNames(), rss0, pheno.length);
	}
}
