package github.sarthakdev143.slideshow_factory.integration.nextcloud;

import github.sarthakdev143.slideshow_factory.exception.TransportException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebDavListingParserTest {

    private final WebDavListingParser parser = new WebDavListingParser();

    @Test
    void parsesEntriesAndFlagsCollections() {
        String xml = """
                <?xml version="1.0"?>
                <d:multistatus xmlns:d="DAV:" xmlns:oc="http://owncloud.org/ns">
                  <d:response>
                    <d:href>/remote.php/dav/files/bot/Photos/</d:href>
                    <d:propstat><d:prop><d:resourcetype><d:collection/></d:resourcetype></d:prop></d:propstat>
                  </d:response>
                  <d:response>
                    <d:href>/remote.php/dav/files/bot/Photos/Summer%20Trip.jpg</d:href>
                    <d:propstat><d:prop><d:resourcetype/></d:prop></d:propstat>
                  </d:response>
                  <d:response>
                    <d:href>/remote.php/dav/files/bot/Photos/1+1.png</d:href>
                    <d:propstat><d:prop><d:resourcetype/></d:prop></d:propstat>
                  </d:response>
                </d:multistatus>
                """;

        List<WebDavListingParser.Entry> entries = parser.parse(xml);

        assertThat(entries).extracting(WebDavListingParser.Entry::name)
                .containsExactly("Photos", "Summer Trip.jpg", "1+1.png");
        assertThat(entries).extracting(WebDavListingParser.Entry::collection)
                .containsExactly(true, false, false);
    }

    @Test
    void rejectsUnreadableBody() {
        assertThatThrownBy(() -> parser.parse("<html>Maintenance"))
                .isInstanceOf(TransportException.class)
                .hasMessageStartingWith("Unreadable WebDAV listing");
    }

    @Test
    void refusesDoctypeDeclarations() {
        String xml = """
                <?xml version="1.0"?>
                <!DOCTYPE d:multistatus [<!ENTITY x SYSTEM "file:///etc/passwd">]>
                <d:multistatus xmlns:d="DAV:"><d:response><d:href>&x;</d:href></d:response></d:multistatus>
                """;

        assertThatThrownBy(() -> parser.parse(xml)).isInstanceOf(TransportException.class);
    }

    @Test
    void lastSegmentIgnoresTrailingSlash() {
        assertThat(WebDavListingParser.lastSegment("/a/b/")).isEqualTo("b");
        assertThat(WebDavListingParser.lastSegment("file.jpg")).isEqualTo("file.jpg");
    }
}
