package lorekeeper.domain.raw;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a document into sections. Text blocks are visited depth first; every heading starts a new section, and any
 * text before the first heading goes into an untitled section.
 */
@ApplicationScoped
public class DocumentSectioner {
    public static final String UNTITLED_SECTION = "Untitled Section";

    public List<DocumentSectionItem> getSections(final DocumentPage page) {
        final List<DocumentSectionItem> sections = new ArrayList<>();

        String currentTitle = null;
        List<String> currentContent = new ArrayList<>();

        for (final DocumentBlock block : getTextBlocks(page.blocks())) {
            if (block.isHeading()) {
                if (currentTitle != null) {
                    sections.add(new DocumentSectionItem(page.id(), page.title(), currentTitle, currentContent));
                }
                currentTitle = block.text();
                currentContent = new ArrayList<>();
            } else {
                if (currentTitle == null) {
                    currentTitle = UNTITLED_SECTION;
                }
                currentContent.add(block.text());
            }
        }

        if (currentTitle != null) {
            sections.add(new DocumentSectionItem(page.id(), page.title(), currentTitle, currentContent));
        }

        return sections;
    }

    public List<DocumentSectionItem> getSections(final List<DocumentPage> pages) {
        return pages.stream()
                .flatMap(page -> getSections(page).stream())
                .toList();
    }

    private List<DocumentBlock> getTextBlocks(final List<DocumentBlock> blocks) {
        final List<DocumentBlock> textBlocks = new ArrayList<>();

        for (final DocumentBlock block : blocks) {
            if (block.hasText()) {
                textBlocks.add(block);
            }
            textBlocks.addAll(getTextBlocks(block.children()));
        }

        return textBlocks;
    }
}
