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

package edu.berkeley.qtlScan.exceptions;

public class QtlException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public QtlException (String msg) {
		super (msg);
	}

	public QtlException (String msg, Throwable cause) {
		super (msg, cause);
	}

	protected static String getMessage (Throwable t) {
		String message = t.getMessage();
		return message != null ? message : t.getClass().getName();
	}

	// a genotype call that no registered symbol knows about
	public static class UnresolvedSymbol extends QtlException {
		private static final long serialVersionUID = 1L;
		private final String symbol;

		public UnresolvedSymbol (String symbol) {
			super (String.format ("Failed to decode genotype \"%s\"", symbol));
			this.symbol = symbol;
		}

		public UnresolvedSymbol (String symbol, String dataset) {
			super (String.format ("Failed to decode genotype \"%s\" in %s", symbol, dataset));
			this.symbol = symbol;
		}

		public String getSymbol () {
			return this.symbol;
		}
	}

	public static class DuplicateSymbol extends QtlException {
		private static final long serialVersionUID = 1L;

		public DuplicateSymbol (String alias, String existing) {
			super (String.format ("Genotype alias \"%s\" is already used by symbol %s", alias, existing));
		}

		// unknown literals only ever name the missing genotype
		public DuplicateSymbol (String alias) {
			super (String.format ("Genotype alias \"%s\" is reserved for missing genotypes", alias));
		}
	}

	// genotype alphabet does not fit the declared cross
	public static class IncompatibleCross extends QtlException {
		private static final long serialVersionUID = 1L;

		public IncompatibleCross (String crossType, String message) {
			super (String.format ("Incompatible with cross %s: %s", crossType, message));
		}
	}

	public static class DimensionMismatch extends QtlException {
		private static final long serialVersionUID = 1L;

		public DimensionMismatch (String what, int expected, int found) {
			super (String.format ("Dimension mismatch for %s: expected %d, found %d", what, expected, found));
		}

		public DimensionMismatch (String message) {
			super (String.format ("Dimension mismatch: %s", message));
		}
	}

	// rank deficient design matrix at one scan position
	public static class DegenerateDesign extends QtlException {
		private static final long serialVersionUID = 1L;
		private final String chromosome;
		private final int positionIdx;

		public DegenerateDesign (String chromosome, int positionIdx, int rank, int numColumns) {
			super (String.format ("Degenerate design on chromosome %s at position %d: rank %d < %d columns", chromosome, positionIdx, rank, numColumns));
			this.chromosome = chromosome;
			this.positionIdx = positionIdx;
		}

		public String getChromosome () {
			return this.chromosome;
		}

		public int getPositionIdx () {
			return this.positionIdx;
		}
	}

	public static class ChromosomeScanFailed extends QtlException {
		private static final long serialVersionUID = 1L;

		public ChromosomeScanFailed (String dataset, String chromosome, Throwable cause) {
			super (String.format ("Scan of chromosome %s in %s failed: %s", chromosome, dataset, getMessage (cause)), cause);
		}
	}
}
