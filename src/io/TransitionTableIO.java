package io;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.jblas.DoubleMatrix;

import lm.EventGroup;
import lm.StateKey;
import lm.TransitionTable;

/**
 * Reads and writes transition tables as CSV: a header of successor labels
 * behind an empty corner cell, then one record per state, its label
 * followed by the probabilities.
 */
public class TransitionTableIO {
	
	private static final Logger LOG = Logger.getLogger(TransitionTableIO.class.getName());
	
	public static void writeTable(TransitionTable table, String path) throws IOException {
		Path file = Paths.get(path);
		if (file.getParent() != null) Files.createDirectories(file.getParent());
		Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
		try {
			writeTable(table, out);
		} finally {
			out.close();
		}
		LOG.info("Wrote "+table+" to "+path);
	}
	
	public static void writeTable(TransitionTable table, Writer out) throws IOException {
		CSVPrinter printer = new CSVPrinter(out, CSVFormat.RFC4180);
		List<String> header = new ArrayList<String>();
		header.add("");
		for (EventGroup successor : table.successors()) header.add(successor.encode());
		printer.printRecord(header);
		for (int row=0; row<table.numStates(); ++row) {
			List<String> record = new ArrayList<String>();
			record.add(table.state(row).encode());
			for (int col=0; col<table.numSuccessors(); ++col) {
				record.add(Double.toString(table.probability(row, col)));
			}
			printer.printRecord(record);
		}
		printer.flush();
	}
	
	public static TransitionTable readTable(String path) throws IOException {
		Reader in = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8);
		try {
			TransitionTable table = readTable(in);
			LOG.info("Read "+table+" from "+path);
			return table;
		} finally {
			in.close();
		}
	}
	
	public static TransitionTable readTable(Reader in) throws IOException {
		CSVParser parser = CSVFormat.RFC4180.parse(in);
		List<EventGroup> successors = new ArrayList<EventGroup>();
		List<StateKey> states = new ArrayList<StateKey>();
		List<double[]> rows = new ArrayList<double[]>();
		try {
			Iterator<CSVRecord> records = parser.iterator();
			if (!records.hasNext()) {
				throw new IOException("Empty transition table file");
			}
			CSVRecord header = records.next();
			for (int i=1; i<header.size(); ++i) {
				successors.add(EventGroup.decode(header.get(i)));
			}
			
			while (records.hasNext()) {
				CSVRecord record = records.next();
				if (record.size() != header.size()) {
					throw new IOException("Record "+record.getRecordNumber()+" has "+record.size()+" cells, expected "+header.size());
				}
				states.add(StateKey.decode(record.get(0)));
				double[] row = new double[successors.size()];
				for (int col=0; col<row.length; ++col) {
					try {
						row[col] = Double.parseDouble(record.get(col+1));
					} catch (NumberFormatException e) {
						throw new IOException("Bad probability \""+record.get(col+1)+"\" in record "+record.getRecordNumber(), e);
					}
				}
				rows.add(row);
			}
		} finally {
			parser.close();
		}
		if (states.isEmpty()) {
			throw new IOException("Transition table file has no states");
		}
		
		DoubleMatrix probs = new DoubleMatrix(rows.toArray(new double[rows.size()][]));
		TransitionTable table = new TransitionTable(states, successors, probs);
		if (!table.isRowStochastic()) {
			LOG.warning("Loaded transition table has rows that do not sum to 1");
		}
		return table;
	}

}
