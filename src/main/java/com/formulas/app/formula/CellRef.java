package com.formulas.app.formula;

/**
 * Coordinates of one cell. Row and column are 0-based; A1 notation (1-based rows,
 * letter columns) only appears at the lexer and printer boundaries.
 *
 * @param col 0-based column index (A = 0)
 * @param row 0-based row index (row "1" = 0)
 * @param absCol {@code $} before the column letters
 * @param absRow {@code $} before the row number
 * @param sheet sheet label, or null for the current sheet
 */
public record CellRef(int col, int row, boolean absCol, boolean absRow, String sheet) {

    public CellRef {
        if (col < 0 || row < 0) {
            throw new IllegalArgumentException("Cell coordinates must be non-negative: col=" + col + ", row=" + row);
        }
    }

    /**
     * Parses a bare A1 address such as {@code "B5"} or {@code "$AA$10"} (no sheet qualifier).
     */
    public static CellRef parse(String a1) {
        int pos = 0;
        boolean absCol = false;
        boolean absRow = false;
        if (pos < a1.length() && a1.charAt(pos) == '$') {
            absCol = true;
            pos++;
        }
        int lettersStart = pos;
        while (pos < a1.length() && Character.isLetter(a1.charAt(pos))) {
            pos++;
        }
        String letters = a1.substring(lettersStart, pos);
        if (pos < a1.length() && a1.charAt(pos) == '$') {
            absRow = true;
            pos++;
        }
        String digits = a1.substring(pos);
        if (letters.isEmpty() || digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Not an A1 cell address: " + a1);
        }
        return new CellRef(letterToColumn(letters), Integer.parseInt(digits) - 1, absCol, absRow, null);
    }

    public CellRef withSheet(String sheetLabel) {
        return new CellRef(col, row, absCol, absRow, sheetLabel);
    }

    /**
     * Shifts the relative coordinates, leaving absolute ones pinned.
     * Throws if the shift would move the reference off the grid.
     */
    public CellRef shift(int colDelta, int rowDelta) {
        return new CellRef(absCol ? col : col + colDelta, absRow ? row : row + rowDelta, absCol, absRow, sheet);
    }

    /**
     * 0 -> A, 25 -> Z, 26 -> AA, 27 -> AB.
     */
    public static String columnToLetter(int col) {
        StringBuilder sb = new StringBuilder();
        int n = col;
        while (n >= 0) {
            sb.insert(0, (char) ('A' + n % 26));
            n = n / 26 - 1;
        }
        return sb.toString();
    }

    /**
     * A -> 0, Z -> 25, AA -> 26. Case-insensitive.
     *
     * @throws IllegalArgumentException if the index does not fit in an int
     */
    public static int letterToColumn(String letters) {
        long result = 0;
        for (int i = 0; i < letters.length(); i++) {
            result = result * 26 + (Character.toUpperCase(letters.charAt(i)) - 'A' + 1);
            if (result - 1 > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Column " + letters + " is out of range");
            }
        }
        return (int) (result - 1);
    }

    /**
     * Sheet names are always quoted; an embedded quote is doubled.
     */
    public static String quoteSheet(String sheet) {
        return "'" + sheet.replace("'", "''") + "'";
    }

    /**
     * A1 notation without the sheet qualifier, e.g. {@code $B5}.
     */
    public String toA1() {
        return (absCol ? "$" : "") + columnToLetter(col) + (absRow ? "$" : "") + (row + 1);
    }

    @Override
    public String toString() {
        return sheet == null ? toA1() : quoteSheet(sheet) + "!" + toA1();
    }
}
