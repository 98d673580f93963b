/*
 * RST-Writer - Document Tree to reStructuredText Rendering
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.rst.writer.issue;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.rst.writer.document.NodeKind;
import org.junit.jupiter.api.Test;

class IssueListTest {

    private static Issue issue(IssueType type, IssueSev sev) {
        return new Issue(type, sev, new IssueLoc("/document[1]", NodeKind.DOCUMENT), "msg");
    }

    @Test
    void filtersByType() {
        IssueList issues =
                new IssueList(
                        List.of(
                                issue(IssueType.UNLINKED_REFERENCE, IssueSev.INFO),
                                issue(IssueType.RAW_CONTENT_SKIPPED, IssueSev.INFO),
                                issue(IssueType.UNLINKED_REFERENCE, IssueSev.INFO)));

        assertEquals(2, issues.ofType(IssueType.UNLINKED_REFERENCE).size());
        assertTrue(issues.ofType(IssueType.ANNOTATION_SHORTENED).isEmpty());
        assertFalse(issues.hasWarnings());
    }

    @Test
    void summaryGroupsByType() {
        IssueList issues = new IssueList();
        issues.add(issue(IssueType.RAW_CONTENT_SKIPPED, IssueSev.INFO));
        issues.add(issue(IssueType.UNSUPPORTED_FORMATTING, IssueSev.WARNING));
        issues.add(issue(IssueType.UNSUPPORTED_FORMATTING, IssueSev.WARNING));

        assertEquals(
                "2 constructs rendered without their formatting\n"
                        + "1 raw blocks in formats other than text",
                issues.summary());
        assertTrue(issues.hasWarnings());
    }

    @Test
    void locationReadsAsKindAtPath() {
        assertEquals(
                "document at /document[1]",
                new IssueLoc("/document[1]", NodeKind.DOCUMENT).toString());
    }

    @Test
    void nullCollectionGivesEmptyList() {
        assertTrue(new IssueList(null).isEmpty());
    }
}
