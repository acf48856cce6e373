package com.galois.proofgen;

import java.io.PrintStream;

/**
 * Options shared by the converters and the proof engine.
 */
public class GenerationOptions {
    /** Default name of the outermost configuration cell. */
    public static final String GENERATED_TOP_SYMBOL = "Lbl'-LT-'generatedTop'-GT-'";

    private PrintStream statusStream = null;
    private String symbolPrefix = "kore_";
    private String sortPrefix = "kore_sort_";
    private String generatedTopSymbol = GENERATED_TOP_SYMBOL;

    public GenerationOptions() {
    }

    /**
     * Set the stream to write status messages to.
     * @param s The stream, or <code>null</code> to disable status messages.
     */
    public void setStatusStream(PrintStream s) {
        statusStream = s;
    }

    public PrintStream getStatusStream() {
        return statusStream;
    }

    /**
     * Set the prefix prepended to Kore symbol names.  The prefix keeps
     * language symbols apart from the symbols of the logic itself.
     */
    public void setSymbolPrefix(String prefix) {
        if (prefix == null) throw new NullPointerException("prefix");
        symbolPrefix = prefix;
    }

    public String getSymbolPrefix() {
        return symbolPrefix;
    }

    /**
     * Set the prefix prepended to Kore sort names.
     */
    public void setSortPrefix(String prefix) {
        if (prefix == null) throw new NullPointerException("prefix");
        sortPrefix = prefix;
    }

    public String getSortPrefix() {
        return sortPrefix;
    }

    /**
     * Set the Kore symbol of the outermost cell.  Cells are discovered
     * by descending from this symbol.
     */
    public void setGeneratedTopSymbol(String symbol) {
        if (symbol == null) throw new NullPointerException("symbol");
        generatedTopSymbol = symbol;
    }

    public String getGeneratedTopSymbol() {
        return generatedTopSymbol;
    }

    /**
     * Write a status message to the status stream, if one is set.
     */
    public void logStatus(String msg) {
        if (statusStream != null) {
            statusStream.printf("proofgen: %s\n", msg);
            statusStream.flush();
        }
    }
}
