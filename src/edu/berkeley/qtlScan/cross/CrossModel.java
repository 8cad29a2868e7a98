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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import edu.berkeley.qtlScan.exceptions.QtlException;
import edu.berkeley.qtlScan.genotype.GenotypeSymbolMapper;
import edu.berkeley.qtlScan.genotype.ObservedGenotypeRegistry;
import edu.berkeley.qtlScan.genotype.TrueGenotype;

// HMM ingredients of one cross type, all in log space. (1,0) and (0,1) are the same state.
public final class CrossModel {

	private static final double LN2 = Math.log (2d);

	// state indices for F2
	private static final int F2_AA = 0;
	private static final int F2_AB = 1;
	private static final int F2_BB = 2;

	private static final TrueGenotype AA = new TrueGenotype (0, 0);
	private static final TrueGenotype AB = new TrueGenotype (0, 1);
	private static final TrueGenotype BB = new TrueGenotype (1, 1);

	private final CrossType crossType;
	private final List<TrueGenotype> possibleGenotypes;

	public CrossModel (CrossType crossType) {
		this.crossType = crossType;
		this.possibleGenotypes = Collections.unmodifiableList (statesFor (crossType));
	}

	private static List<TrueGenotype> statesFor (CrossType crossType) {
		switch (crossType) {
		case F2:
			return Arrays.asList (AA, AB, BB);
		case BC:
			return Arrays.asList (AA, AB);
		case RISELF:
		case RISIB:
			return Arrays.asList (AA, BB);
		default:
			throw new QtlException.IncompatibleCross (String.valueOf (crossType), "no hidden states defined");
		}
	}

	public CrossType getCrossType () {
		return this.crossType;
	}

	public List<TrueGenotype> getPossibleGenotypes () {
		return this.possibleGenotypes;
	}

	public int numStates () {
		return this.possibleGenotypes.size();
	}

	// -1 if the cross can not produce this genotype
	public int stateIndex (TrueGenotype trueGenotype) {
		for (int s = 0; s < this.possibleGenotypes.size(); s++) {
			TrueGenotype state = this.possibleGenotypes.get(s);
			if (state.equals (trueGenotype) || state.equals (trueGenotype.reversed())) return s;
		}
		return -1;
	}

	private int checkedStateIndex (TrueGenotype trueGenotype) {
		int state = this.stateIndex (trueGenotype);
		if (state < 0) throw new QtlException.IncompatibleCross (this.crossType.name(), "true genotype " + trueGenotype + " is not possible");
		return state;
	}

	// marginal genotype probability
	public double init (TrueGenotype trueGenotype) {
		return this.initByState (this.checkedStateIndex (trueGenotype));
	}

	public double initByState (int state) {
		switch (this.crossType) {
		case F2:
			return state == F2_AB ? -LN2 : -2d * LN2;
		case BC:
		case RISELF:
		case RISIB:
			return -LN2;
		default:
			throw new QtlException.IncompatibleCross (this.crossType.name(), "no initial probabilities");
		}
	}

	// which states an observed symbol can come from
	public boolean[] compatibleStates (GenotypeSymbolMapper observed) {
		boolean[] compatible = new boolean[this.numStates()];
		for (int s = 0; s < this.numStates(); s++) {
			TrueGenotype state = this.possibleGenotypes.get(s);
			compatible[s] = observed.matches (state) || observed.matches (state.reversed());
		}
		return compatible;
	}

	// emission probability (marker genotype "penetrance")
	public double emit (GenotypeSymbolMapper observed, TrueGenotype trueGenotype, double errorProb) {
		return this.emitLogProbs (observed, errorProb)[this.checkedStateIndex (trueGenotype)];
	}

	public double[] emitLogProbs (GenotypeSymbolMapper observed, double errorProb) {
		int numStates = this.numStates();
		double[] logEmission = new double[numStates];

		// missing means no information
		if (observed == null || observed.isMissing()) return logEmission;

		boolean[] compatible = this.compatibleStates (observed);
		int numCompatible = 0;
		for (boolean c : compatible) if (c) numCompatible++;
		if (numCompatible == 0) {
			throw new QtlException.IncompatibleCross (this.crossType.name(), "observed genotype " + observed.getName() + " " + observed + " matches none of " + this.possibleGenotypes);
		}

		// the error mass is spread over the alternatives
		double logCompatible = Math.log (1d - errorProb * (numStates - numCompatible) / (numStates - 1));
		double logIncompatible = Math.log (errorProb) - Math.log (numStates - 1);
		for (int s = 0; s < numStates; s++) {
			logEmission[s] = compatible[s] ? logCompatible : logIncompatible;
		}
		return logEmission;
	}

	// transition probabilities
	public double step (TrueGenotype left, TrueGenotype right, double recFrac) {
		return this.stepByState (this.checkedStateIndex (left), this.checkedStateIndex (right), recFrac);
	}

	public double stepByState (int left, int right, double recFrac) {
		assert (recFrac >= 0d && recFrac <= 0.5d);

		switch (this.crossType) {
		case F2:
			return stepF2 (left, right, recFrac);
		case BC:
			return stepTwoState (left, right, recFrac);
		case RISELF:
			// map expansion for selfing
			return stepTwoState (left, right, 2d * recFrac / (1d + 2d * recFrac));
		case RISIB:
			// and for sib mating
			return stepTwoState (left, right, 4d * recFrac / (1d + 6d * recFrac));
		default:
			throw new QtlException.IncompatibleCross (this.crossType.name(), "no transition probabilities");
		}
	}

	private double stepF2 (int left, int right, double r) {
		switch (left) {
		case F2_AA:
		case F2_BB:
			// homozygote, symmetric under relabelling A and B
			if (right == F2_AB) return LN2 + Math.log (1d - r) + Math.log (r);
			if (right == left) return 2d * Math.log (1d - r);
			if (right == F2_AA || right == F2_BB) return 2d * Math.log (r);
			break;
		case F2_AB:
			if (right == F2_AA || right == F2_BB) return Math.log (r) + Math.log (1d - r);
			if (right == F2_AB) return Math.log ((1d - r) * (1d - r) + r * r);
			break;
		default:
			break;
		}
		throw new QtlException.IncompatibleCross (this.crossType.name(), "no transition from state " + left + " to state " + right);
	}

	private double stepTwoState (int left, int right, double r) {
		if (left < 0 || left > 1 || right < 0 || right > 1) {
			throw new QtlException.IncompatibleCross (this.crossType.name(), "no transition from state " + left + " to state " + right);
		}
		return left == right ? Math.log (1d - r) : Math.log (r);
	}

	// F2 codes AA AB BB not-BB not-AA ("A H B D C"), BC AA AB ("A H"), RI AA BB ("A B")
	public ObservedGenotypeRegistry createSymbolRegistry (String genotypeIds, String naIds) {
		String[] ids = genotypeIds.trim().split ("\\s+");
		ObservedGenotypeRegistry symbols = new ObservedGenotypeRegistry();

		// the missing one goes first
		String[] naSplit = naIds.trim().split ("\\s+");
		GenotypeSymbolMapper na = new GenotypeSymbolMapper (naSplit[0]);
		for (int i = 1; i < naSplit.length; i++) na.addEncoding (naSplit[i]);
		symbols.register (na);

		switch (this.crossType) {
		case F2:
			if (ids.length < 5) throw new IllegalArgumentException ("Need to provide 5 genotype symbols (eg, 'A H B D C').");
			symbols.register (new GenotypeSymbolMapper (ids[0], true, AA));
			symbols.register (new GenotypeSymbolMapper (ids[2], true, BB));
			symbols.register (new GenotypeSymbolMapper (ids[1], false, AB));
			symbols.register (new GenotypeSymbolMapper (ids[3], false, AB, AA));
			symbols.register (new GenotypeSymbolMapper (ids[4], false, AB, BB));
			break;
		case BC:
			if (ids.length < 2) throw new IllegalArgumentException ("Need to provide 2 genotype symbols (eg, 'A H').");
			symbols.register (new GenotypeSymbolMapper (ids[0], true, AA));
			symbols.register (new GenotypeSymbolMapper (ids[1], false, AB));
			break;
		case RISELF:
		case RISIB:
			if (ids.length < 2) throw new IllegalArgumentException ("Need to provide 2 genotype symbols (eg, 'A B').");
			symbols.register (new GenotypeSymbolMapper (ids[0], true, AA));
			symbols.register (new GenotypeSymbolMapper (ids[1], true, BB));
			break;
		default:
			throw new QtlException.IncompatibleCross (this.crossType.name(), "no default genotype symbols");
		}
		return symbols;
	}

	public ObservedGenotypeRegistry createSymbolRegistry () {
		return this.createSymbolRegistry (this.crossType.defaultGenotypeIds, CrossType.DEFAULT_NA_IDS);
	}

	// every symbol of a dataset has to fit at least one state
	public void checkSymbols (ObservedGenotypeRegistry registry) {
		for (GenotypeSymbolMapper symbol : registry.getSymbols()) {
			if (symbol.isMissing()) continue;
			boolean any = false;
			for (boolean c : this.compatibleStates (symbol)) any |= c;
			if (!any) throw new QtlException.IncompatibleCross (this.crossType.name(), "symbol " + symbol.getName() + " " + symbol + " matches none of " + this.possibleGenotypes);
		}
	}

	@Override
	public String toString () {
		return this.crossType.name() + this.possibleGenotypes;
	}
}
