package io.github.deco4j.processor;

import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds the Maven module that encloses a directory.
 */
final class ModuleLocator {

    static final String MODULE_FILE = "pom.xml";

    private ModuleLocator() {
    }

    /**
     * Walks upward from {@code start} to the nearest directory holding a {@code pom.xml}.
     */
    static Optional<Path> findModuleFile(Path start) {
        Path dir = start.toAbsolutePath().normalize();
        while (dir != null) {
            Path candidate = dir.resolve(MODULE_FILE);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            dir = dir.getParent();
        }
        return Optional.empty();
    }

    /**
     * Reads the project's own {@code artifactId} (not the parent's) from a pom file.
     *
     * @throws IOException if the file cannot be read or is not well-formed XML
     */
    static Optional<String> artifactId(Path pom) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            Document document = factory.newDocumentBuilder().parse(pom.toFile());
            for (Node child = document.getDocumentElement().getFirstChild(); child != null;
                 child = child.getNextSibling()) {
                if (child.getNodeType() == Node.ELEMENT_NODE && "artifactId".equals(child.getNodeName())) {
                    return Optional.of(child.getTextContent().strip());
                }
            }
            return Optional.empty();
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Cannot read " + pom + ": " + e.getMessage(), e);
        }
    }
}
