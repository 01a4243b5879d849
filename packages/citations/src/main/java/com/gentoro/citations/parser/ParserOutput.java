package com.gentoro.citations.parser;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gentoro.citations.model.Anchor;
import com.gentoro.citations.model.Heading;
import com.gentoro.citations.model.Link;
import com.vladsch.flexmark.util.ast.Document;
import java.util.List;

/**
 * Everything extracted from one markdown file.
 *
 * @param filePath absolute path of the parsed file
 * @param content raw UTF-8 file text
 * @param tokens flexmark node tree; every node keeps its source offsets into {@code content}
 */
public record ParserOutput(
    String filePath,
    String content,
    @JsonIgnore Document tokens,
    List<Link> links,
    List<Heading> headings,
    List<Anchor> anchors) {

  public ParserOutput {
    links = List.copyOf(links);
    headings = List.copyOf(headings);
    anchors = List.copyOf(anchors);
  }
}
