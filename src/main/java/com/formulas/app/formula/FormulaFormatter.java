package com.formulas.app.formula;

import java.text.NumberFormat;
import java.util.Currency;
import java.util.Locale;

/**
 * Renders results as display text. Presentation only; evaluation never goes through here.
 *
 * <p>Percent values are stored in percent units (a cell "12.5%" evaluates to 12.5), so they are
 * divided by 100 before the locale's percent style is applied.
 */
public final class FormulaFormatter {

    private final Locale locale;
    private final Currency currency;

    public FormulaFormatter(Locale locale, Currency currency) {
        this.locale = locale;
        this.currency = currency;
    }

    public static FormulaFormatter forLanguageTag(String languageTag, String currencyCode) {
        return new FormulaFormatter(Locale.forLanguageTag(languageTag), Currency.getInstance(currencyCode));
    }

    public String format(FormulaResult result) {
        return result.isOk() ? format(result.getValue(), result.getFormat()) : result.getError();
    }

    public String format(double value, ValueFormat format) {
        // NumberFormat is not thread-safe; build one per call
        NumberFormat nf;
        switch (format == null ? ValueFormat.PLAIN : format) {
            case CURRENCY:
                nf = NumberFormat.getCurrencyInstance(locale);
                nf.setCurrency(currency);
                return nf.format(value);
            case PERCENT:
                nf = NumberFormat.getPercentInstance(locale);
                nf.setMaximumFractionDigits(2);
                return nf.format(value / 100d);
            default:
                nf = NumberFormat.getNumberInstance(locale);
                nf.setMaximumFractionDigits(3);
                return nf.format(value);
        }
    }
}
