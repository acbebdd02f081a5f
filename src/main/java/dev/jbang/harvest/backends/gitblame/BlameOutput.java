package dev.jbang.harvest.backends.gitblame;

import dev.jbang.harvest.error.ParseException;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser of {@code git blame --incremental} output.
 *
 * <p>Every group starts with a header {@code <hash> <prev_line> <this_line> <lines>}. The first group
 * for a hash/line triple may carry commit metadata ({@code author}, {@code committer-time},
 * {@code summary}, {@code previous}, ...) and every group ends with a {@code filename} line. A group
 * whose triple was already seen is abbreviated to the header and the filename. Paths that git
 * prints C-quoted are unquoted.
 */
public class BlameOutput {
	static final String HASH = "hash";
	static final String PREV_LINE = "prev_line";
	static final String THIS_LINE = "this_line";
	static final String LINES = "lines";
	static final String FILENAME = "filename";
	static final String PREVIOUS = "previous";

	private final byte[] text;

	public BlameOutput(byte[] text) {
		this.text = text;
	}

	public byte[] text() {
		return text;
	}

	/**
	 * Parse the output into attribution records, in input order. Abbreviated groups produce only
	 * {@code hash}, {@code prev_line}, {@code this_line}, {@code lines} and {@code filename}.
	 *
	 * @throws ParseException If a header does not have four fields, an abbreviated group carries
	 *     metadata, or the input ends inside a group
	 */
	public List<Map<String, String>> analyze() {
		List<Map<String, String>> records = new ArrayList<>();
		Set<String> seen = new HashSet<>();

		Map<String, String> current = null;
		boolean abbreviated = false;
		int lineNumber = 0;

		for (String line : new String(text, StandardCharsets.UTF_8).split("\n")) {
			lineNumber++;
			if (line.isEmpty()) {
				continue;
			}

			if (current == null) {
				String[] header = line.split(" ");
				if (header.length != 4) {
					throw new ParseException("Invalid blame header '" + line + "'", lineNumber);
				}
				current = new LinkedHashMap<>();
				current.put(HASH, header[0]);
				current.put(PREV_LINE, header[1]);
				current.put(THIS_LINE, header[2]);
				current.put(LINES, header[3]);
				abbreviated = !seen.add(header[0] + " " + header[1] + " " + header[2]);
				continue;
			}

			int sep = line.indexOf(' ');
			String key = sep < 0 ? line : line.substring(0, sep);
			String value = sep < 0 ? "" : line.substring(sep + 1);

			if (FILENAME.equals(key)) {
				current.put(FILENAME, unquotePath(value));
				records.add(current);
				current = null;
			} else if (abbreviated) {
				throw new ParseException("Unexpected '" + key + "' in a repeated blame group", lineNumber);
			} else if (PREVIOUS.equals(key) && value.indexOf(' ') > 0) {
				int pathStart = value.indexOf(' ') + 1;
				current.put(key, value.substring(0, pathStart) + unquotePath(value.substring(pathStart)));
			} else {
				current.put(key, value);
			}
		}

		if (current != null) {
			throw new ParseException("Blame group of " + current.get(HASH) + " has no filename", lineNumber);
		}
		return records;
	}

	/**
	 * Undo git's C-style quoting of a path. Git quotes paths holding control characters, quotes,
	 * backslashes or non-ASCII bytes, e.g. {@code "caf\303\251.txt"}. Unquoted values are returned
	 * as is.
	 */
	static String unquotePath(String value) {
		if (value.length() < 2 || value.charAt(0) != '"' || value.charAt(value.length() - 1) != '"') {
			return value;
		}
		String quoted = value.substring(1, value.length() - 1);
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		int i = 0;
		while (i < quoted.length()) {
			char c = quoted.charAt(i);
			if (c != '\\' || i + 1 == quoted.length()) {
				int codePoint = quoted.codePointAt(i);
				bytes.writeBytes(new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8));
				i += Character.charCount(codePoint);
				continue;
			}
			char escaped = quoted.charAt(i + 1);
			i += 2;
			if (escaped >= '0' && escaped <= '7') {
				// up to three octal digits make one raw byte
				int octal = escaped - '0';
				for (int digits = 1; digits < 3 && i < quoted.length(); digits++) {
					char next = quoted.charAt(i);
					if (next < '0' || next > '7') {
						break;
					}
					octal = octal * 8 + (next - '0');
					i++;
				}
				bytes.write(octal);
				continue;
			}
			bytes.write(
					switch (escaped) {
						case 'a' -> 0x07;
						case 'b' -> '\b';
						case 't' -> '\t';
						case 'n' -> '\n';
						case 'v' -> 0x0b;
						case 'f' -> '\f';
						case 'r' -> '\r';
						default -> escaped;
					});
		}
		return bytes.toString(StandardCharsets.UTF_8);
	}
}
