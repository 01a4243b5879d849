package com.gentoro.citations.document;

import static org.junit.jupiter.api.Assertions.*;

import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.Paragraph;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Document;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TokenFlattenerTest {

  @Test
  @DisplayName("Visits children before following siblings and records nesting depth")
  void depthFirstOrder() {
    Document doc = Parser.builder().build().parse("# A\n\n- item\n\n## B\n");

    List<TokenFlattener.FlatToken> flat = TokenFlattener.flatten(doc);

    assertInstanceOf(Heading.class, flat.get(0).node());
    assertEquals(0, flat.get(0).depth());

    int listIndex = -1;
    int paragraphIndex = -1;
    int secondHeading = -1;
    for (int i = 0; i < flat.size(); i++) {
      if (flat.get(i).node() instanceof BulletList && listIndex < 0) listIndex = i;
      if (flat.get(i).node() instanceof Paragraph && paragraphIndex < 0) paragraphIndex = i;
      if (flat.get(i).node() instanceof Heading h && h.getLevel() == 2) secondHeading = i;
    }
    assertTrue(listIndex >= 0 && paragraphIndex > listIndex, "list item content follows list");
    assertTrue(secondHeading > paragraphIndex, "nested content precedes the next sibling");
    assertTrue(flat.get(paragraphIndex).depth() > flat.get(listIndex).depth());
    assertEquals(0, flat.get(secondHeading).depth());
  }
}
