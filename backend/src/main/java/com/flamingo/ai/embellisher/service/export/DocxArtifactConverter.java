package com.flamingo.ai.embellisher.service.export;

import com.flamingo.ai.embellisher.domain.entity.Note;
import com.flamingo.ai.embellisher.domain.enums.ExportFormat;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.apache.poi.xwpf.usermodel.Borders;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListBlock;
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
 * Word document export. The Markdown content is parsed with commonmark and written block by block
 * with Apache POI: headings, paragraphs with bold/italic/code runs, nested lists and code blocks.
 */
@Component
public class DocxArtifactConverter implements ArtifactConverter {

  private static final Parser PARSER = Parser.builder().build();
  private static final int[] HEADING_SIZES = {20, 16, 14, 13, 12, 12};
  private static final int LIST_INDENT_TWIPS = 360;
  private static final String MONOSPACE = "Courier New";

  @Override
  public boolean supports(ExportFormat format) {
    return format == ExportFormat.DOCX;
  }

  @Override
  public byte[] convert(Note note) {
    try (XWPFDocument document = new XWPFDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      XWPFParagraph title = document.createParagraph();
      title.setAlignment(ParagraphAlignment.CENTER);
      XWPFRun titleRun = title.createRun();
      titleRun.setText(ExportDocumentTitles.title(note));
      titleRun.setBold(true);
      titleRun.setFontSize(24);

      Node root = PARSER.parse(note.getEnhancedContent());
      for (Node block = root.getFirstChild(); block != null; block = block.getNext()) {
        writeBlock(document, block, 0);
      }

      document.write(out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to build DOCX for note " + note.getId(), e);
    }
  }

  private void writeBlock(XWPFDocument document, Node block, int depth) {
    if (block instanceof Heading heading) {
      XWPFParagraph paragraph = document.createParagraph();
      paragraph.setSpacingBefore(240);
      int size = HEADING_SIZES[Math.min(heading.getLevel(), HEADING_SIZES.length) - 1];
      writeInlines(paragraph, heading, new RunStyle(true, false, size));
    } else if (block instanceof Paragraph) {
      XWPFParagraph paragraph = document.createParagraph();
      paragraph.setIndentationLeft(depth * LIST_INDENT_TWIPS);
      writeInlines(paragraph, block, RunStyle.PLAIN);
    } else if (block instanceof ListBlock list) {
      writeList(document, list, depth);
    } else if (block instanceof FencedCodeBlock code) {
      writeCode(document, code.getLiteral(), depth);
    } else if (block instanceof IndentedCodeBlock code) {
      writeCode(document, code.getLiteral(), depth);
    } else if (block instanceof BlockQuote) {
      for (Node child = block.getFirstChild(); child != null; child = child.getNext()) {
        writeBlock(document, child, depth + 1);
      }
    } else if (block instanceof ThematicBreak) {
      document.createParagraph().setBorderBottom(Borders.SINGLE);
    }
  }

  private void writeList(XWPFDocument document, ListBlock list, int depth) {
    int number = list instanceof OrderedList ordered ? ordered.getStartNumber() : 0;
    for (Node item = list.getFirstChild(); item != null; item = item.getNext()) {
      if (!(item instanceof ListItem)) {
        continue;
      }
      String marker = list instanceof BulletList ? "• " : (number++) + ". ";
      boolean first = true;
      for (Node child = item.getFirstChild(); child != null; child = child.getNext()) {
        if (first && child instanceof Paragraph) {
          XWPFParagraph paragraph = document.createParagraph();
          paragraph.setIndentationLeft((depth + 1) * LIST_INDENT_TWIPS);
          paragraph.setIndentationHanging(LIST_INDENT_TWIPS / 2);
          paragraph.createRun().setText(marker);
          writeInlines(paragraph, child, RunStyle.PLAIN);
        } else {
          writeBlock(document, child, depth + 1);
        }
        first = false;
      }
    }
  }

  private void writeCode(XWPFDocument document, String literal, int depth) {
    XWPFParagraph paragraph = document.createParagraph();
    paragraph.setIndentationLeft((depth + 1) * LIST_INDENT_TWIPS);
    String[] lines = literal.stripTrailing().split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      XWPFRun run = paragraph.createRun();
      run.setFontFamily(MONOSPACE);
      run.setText(lines[i]);
      if (i < lines.length - 1) {
        run.addBreak();
      }
    }
  }

  private void writeInlines(XWPFParagraph paragraph, Node parent, RunStyle style) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNext()) {
      if (node instanceof Text text) {
        style.apply(paragraph.createRun()).setText(text.getLiteral());
      } else if (node instanceof Code code) {
        XWPFRun run = style.apply(paragraph.createRun());
        run.setFontFamily(MONOSPACE);
        run.setText(code.getLiteral());
      } else if (node instanceof StrongEmphasis) {
        writeInlines(paragraph, node, style.withBold());
      } else if (node instanceof Emphasis) {
        writeInlines(paragraph, node, style.withItalic());
      } else if (node instanceof SoftLineBreak) {
        style.apply(paragraph.createRun()).setText(" ");
      } else if (node instanceof HardLineBreak) {
        paragraph.createRun().addBreak();
      } else {
        // links, images and inline HTML: keep their text
        writeInlines(paragraph, node, style);
      }
    }
  }

  private record RunStyle(boolean bold, boolean italic, int fontSize) {

    static final RunStyle PLAIN = new RunStyle(false, false, 11);

    RunStyle withBold() {
      return new RunStyle(true, italic, fontSize);
    }

    RunStyle withItalic() {
      return new RunStyle(bold, true, fontSize);
    }

    XWPFRun apply(XWPFRun run) {
      run.setBold(bold);
      run.setItalic(italic);
      run.setFontSize(fontSize);
      return run;
    }
  }
}
