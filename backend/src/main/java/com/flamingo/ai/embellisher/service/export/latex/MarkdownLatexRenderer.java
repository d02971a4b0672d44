package com.flamingo.ai.embellisher.service.export.latex;

import com.flamingo.ai.embellisher.domain.enums.LatexStyle;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.Parser;
import org.springframework.stereotype.Component;

/**
 * Deterministic Markdown to LaTeX conversion used when AI conversion is disabled or fails.
 *
 * <p>Headings map to {@code \section}, {@code \subsection} and {@code \subsubsection}; deeper
 * levels become bold paragraphs. Lists, emphasis, inline code, links and code blocks are kept.
 */
@Component
public class MarkdownLatexRenderer {

  private static final Parser PARSER = Parser.builder().build();
  private static final String[] SECTION_COMMANDS = {"section", "subsection", "subsubsection"};

  /** Renders a complete document. */
  public String render(
      String markdown, String title, String author, LatexStyle style, String fontPreference) {
    return LatexPreamble.head(title, author, style, fontPreference)
        + renderBody(markdown)
        + "\n\\end{document}\n";
  }

  /** Renders only the document body. */
  public String renderBody(String markdown) {
    LatexVisitor visitor = new LatexVisitor();
    PARSER.parse(markdown).accept(visitor);
    return visitor.out.toString();
  }

  private static final class LatexVisitor extends AbstractVisitor {

    private final StringBuilder out = new StringBuilder();

    @Override
    public void visit(Heading heading) {
      int level = heading.getLevel();
      if (level <= SECTION_COMMANDS.length) {
        out.append('\\').append(SECTION_COMMANDS[level - 1]).append('{');
        visitChildren(heading);
        out.append("}\n\n");
      } else {
        out.append("\\paragraph{");
        visitChildren(heading);
        out.append("}\n");
      }
    }

    @Override
    public void visit(Paragraph paragraph) {
      visitChildren(paragraph);
      out.append(paragraph.getParent() instanceof ListItem ? "\n" : "\n\n");
    }

    @Override
    public void visit(BulletList list) {
      out.append("\\begin{itemize}\n");
      visitChildren(list);
      out.append("\\end{itemize}\n\n");
    }

    @Override
    public void visit(OrderedList list) {
      out.append("\\begin{enumerate}\n");
      visitChildren(list);
      out.append("\\end{enumerate}\n\n");
    }

    @Override
    public void visit(ListItem item) {
      out.append("\\item ");
      visitChildren(item);
    }

    @Override
    public void visit(BlockQuote quote) {
      out.append("\\begin{quote}\n");
      visitChildren(quote);
      out.append("\\end{quote}\n\n");
    }

    @Override
    public void visit(FencedCodeBlock code) {
      verbatim(code.getLiteral());
    }

    @Override
    public void visit(IndentedCodeBlock code) {
      verbatim(code.getLiteral());
    }

    @Override
    public void visit(ThematicBreak thematicBreak) {
      out.append("\\noindent\\rule{\\linewidth}{0.4pt}\n\n");
    }

    @Override
    public void visit(Text text) {
      out.append(LatexEscaper.escapeKeepingMath(text.getLiteral()));
    }

    @Override
    public void visit(StrongEmphasis strong) {
      wrap("\\textbf{", strong);
    }

    @Override
    public void visit(Emphasis emphasis) {
      wrap("\\textit{", emphasis);
    }

    @Override
    public void visit(Code code) {
      out.append("\\texttt{").append(LatexEscaper.escape(code.getLiteral())).append('}');
    }

    @Override
    public void visit(Link link) {
      out.append("\\href{").append(link.getDestination().replace("%", "\\%").replace("#", "\\#"));
      out.append("}{");
      visitChildren(link);
      out.append('}');
    }

    @Override
    public void visit(SoftLineBreak softLineBreak) {
      out.append('\n');
    }

    @Override
    public void visit(HardLineBreak hardLineBreak) {
      out.append("\\\\\n");
    }

    private void wrap(String command, Node node) {
      out.append(command);
      visitChildren(node);
      out.append('}');
    }

    private void verbatim(String literal) {
      out.append("\\begin{verbatim}\n").append(literal);
      if (!literal.endsWith("\n")) {
        out.append('\n');
      }
      out.append("\\end{verbatim}\n\n");
    }
  }
}
