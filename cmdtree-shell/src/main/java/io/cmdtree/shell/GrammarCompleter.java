package io.cmdtree.shell;

import io.cmdtree.core.parse.Parser;
import java.util.List;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

/**
 * JLine completer backed by a grammar. The text before the cursor is completed as a whole, so
 * candidates follow the grammar rather than JLine's word splitting.
 */
public class GrammarCompleter implements Completer {
  private final Parser parser;

  public GrammarCompleter(Parser parser) {
    this.parser = parser;
  }

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    String text = line.line();
    int cursor = Math.min(Math.max(line.cursor(), 0), text.length());
    for (String candidate : parser.complete(text.substring(0, cursor))) {
      String value = candidate.stripTrailing();
      // a trailing space means the word is finished; otherwise (a directory, say) keep typing
      boolean complete = value.length() < candidate.length();
      candidates.add(new Candidate(value, value, null, null, null, null, complete));
    }
  }
}
