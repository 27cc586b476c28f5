package com.brokerbridge.engine.router;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the financial-advisor XML documents sent by the broker.
 */
final class AdvisorXml {

    record Group(String name, String defaultMethod, List<String> accounts) {
    }

    record Alias(String account, String alias) {
    }

    private AdvisorXml() {
    }

    /**
     * {@code <ListOfGroups><Group><name/><defaultMethod/><ListOfAccts><Account><acct/>...}
     */
    static List<Group> parseGroups(String xml) {
        Element root = parse(xml, "ListOfGroups");
        List<Group> groups = new ArrayList<>();
        for (Element group : children(root, "Group")) {
            List<String> accounts = new ArrayList<>();
            for (Element list : children(group, "ListOfAccts")) {
                for (Element account : children(list, "Account")) {
                    accounts.add(text(account, "acct"));
                }
            }
            groups.add(new Group(text(group, "name"), text(group, "defaultMethod"), accounts));
        }
        return groups;
    }

    /**
     * {@code <ListOfAccountAliases><AccountAlias><account/><alias/>...}
     */
    static List<Alias> parseAliases(String xml) {
        Element root = parse(xml, "ListOfAccountAliases");
        List<Alias> aliases = new ArrayList<>();
        for (Element alias : children(root, "AccountAlias")) {
            aliases.add(new Alias(text(alias, "account"), text(alias, "alias")));
        }
        return aliases;
    }

    private static Element parse(String xml, String expectedRoot) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document document = builder.parse(new InputSource(new StringReader(xml)));
            Element root = document.getDocumentElement();
            if (!expectedRoot.equals(root.getTagName())) {
                throw new IllegalArgumentException("Unexpected XML root " + root.getTagName() + ", expected " + expectedRoot);
            }
            return root;
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new IllegalArgumentException("Malformed advisor XML: " + e.getMessage(), e);
        }
    }

    private static List<Element> children(Element parent, String tag) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element && tag.equals(((Element) node).getTagName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static String text(Element parent, String tag) {
        List<Element> matches = children(parent, tag);
        return matches.isEmpty() ? null : matches.get(0).getTextContent().trim();
    }
}
