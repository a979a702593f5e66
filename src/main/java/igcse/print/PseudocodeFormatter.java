package igcse.print;

import igcse.Severity;
import igcse.Warning;
import igcse.WarningCode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Joins engine lines into the final pseudocode text.
 *
 * Indentation is taken as given. Block keywords are checked for balance and for
 * matching indentation; problems are reported as {@link WarningCode#FORMAT_MISMATCH}
 * but the text is never changed to fix them.
 */
public final class PseudocodeFormatter {
	/**
	 * Block closer for each opener keyword.
	 */
	private static final Map<String, String> CLOSERS = Map.of(
			"IF", "ENDIF",
			"WHILE", "ENDWHILE",
			"FOR", "NEXT",
			"REPEAT", "UNTIL",
			"CASE", "ENDCASE",
			"PROCEDURE", "ENDPROCEDURE",
			"FUNCTION", "ENDFUNCTION");

	private record Open(String keyword, int indent, int lineNumber) {
	}

	public String format(List<String> lines) {
		return format(lines, new ArrayList<>());
	}

	/**
	 * @param warnings receives one warning per balance problem found
	 */
	public String format(List<String> lines, List<Warning> warnings) {
		List<String> cleaned = new ArrayList<>();
		for (String line : lines) {
			// engine lines may carry embedded newlines from multi-line comments
			for (String part : line.split("\n", -1)) {
				cleaned.add(part.stripTrailing());
			}
		}
		while (!cleaned.isEmpty() && cleaned.get(cleaned.size() - 1).isEmpty()) {
			cleaned.remove(cleaned.size() - 1);
		}
		warnings.addAll(checkBalance(cleaned));
		return String.join("\n", cleaned);
	}

	public List<Warning> checkBalance(List<String> lines) {
		List<Warning> problems = new ArrayList<>();
		Deque<Open> open = new ArrayDeque<>();

		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			String text = line.strip();
			if (text.isEmpty() || text.startsWith("//")) {
				continue;
			}
			int indent = line.length() - line.stripLeading().length();
			int lineNumber = i + 1;
			String first = firstWord(text);

			if (first.equals("ELSE")) {
				Open top = open.peek();
				if (top == null || !top.keyword().equals("IF")) {
					problems.add(mismatch(lineNumber, "ELSE without an open IF"));
				} else if (top.indent() != indent) {
					problems.add(mismatch(lineNumber, "ELSE is not aligned with its IF on line " + top.lineNumber()));
				}
				continue;
			}

			if (CLOSERS.containsKey(first) && isOpener(first, text)) {
				open.push(new Open(first, indent, lineNumber));
				continue;
			}

			if (CLOSERS.containsValue(first)) {
				Open top = open.poll();
				if (top == null) {
					problems.add(mismatch(lineNumber, first + " without an opening block"));
				} else if (!CLOSERS.get(top.keyword()).equals(first)) {
					problems.add(mismatch(lineNumber, first + " closes " + top.keyword() + " opened on line "
							+ top.lineNumber()));
				} else if (top.indent() != indent) {
					problems.add(mismatch(lineNumber, first + " is not aligned with " + top.keyword() + " on line "
							+ top.lineNumber()));
				}
			}
		}

		for (Open unclosed : open) {
			problems.add(mismatch(unclosed.lineNumber(), unclosed.keyword() + " is never closed"));
		}
		return problems;
	}

	private static boolean isOpener(String first, String text) {
		return switch (first) {
			case "IF" -> text.endsWith("THEN");
			case "CASE" -> text.startsWith("CASE OF");
			default -> true;
		};
	}

	private static String firstWord(String text) {
		int space = text.indexOf(' ');
		return space < 0 ? text : text.substring(0, space);
	}

	private static Warning mismatch(int outputLine, String message) {
		return new Warning(WarningCode.FORMAT_MISMATCH, "Output line " + outputLine + ": " + message,
				Severity.WARNING, 0);
	}
}
