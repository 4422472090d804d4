package org.example.mjcf.export;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Serializes an element tree as indented XML with StAX.
 *
 * Output:
 * <pre>
 * {@code
 * <?xml version="1.0" encoding="UTF-8"?>
 * <mujoco model="...">
 *   <option integrator="implicitfast" .../>
 *   ...
 * </mujoco>
 * }
 * </pre>
 */
public final class MjcfWriter {

    private static final String INDENT = "  ";

    private MjcfWriter() {
    }

    public static String toXml(MjcfElement document) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(document, out);
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to serialize MJCF document: " + e.getMessage(), e);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    public static void write(MjcfElement document, OutputStream out) throws XMLStreamException {
        XMLOutputFactory factory = XMLOutputFactory.newInstance();
        XMLStreamWriter xml = factory.createXMLStreamWriter(out, "UTF-8");

        xml.writeStartDocument("UTF-8", "1.0");
        xml.writeCharacters("\n");
        writeElement(xml, document, 0);
        xml.writeCharacters("\n");
        xml.writeEndDocument();
        xml.flush();
        xml.close();
    }

    private static void writeElement(XMLStreamWriter xml, MjcfElement element, int depth)
            throws XMLStreamException {
        xml.writeCharacters(INDENT.repeat(depth));
        if (element.children().isEmpty()) {
            xml.writeEmptyElement(element.tag());
            writeAttributes(xml, element);
            return;
        }

        xml.writeStartElement(element.tag());
        writeAttributes(xml, element);
        for (MjcfElement child : element.children()) {
            xml.writeCharacters("\n");
            writeElement(xml, child, depth + 1);
        }
        xml.writeCharacters("\n" + INDENT.repeat(depth));
        xml.writeEndElement(); // element.tag()
    }

    private static void writeAttributes(XMLStreamWriter xml, MjcfElement element) throws XMLStreamException {
        for (Map.Entry<String, String> attr : element.attributes().entrySet()) {
            xml.writeAttribute(attr.getKey(), attr.getValue());
        }
    }
}
