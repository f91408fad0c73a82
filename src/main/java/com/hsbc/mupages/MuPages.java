package com.hsbc.mupages;

import java.io.InputStream;
import java.util.Properties;

class MuPages {

    /**
     * @return Returns the current version of mu-template-pages, or 0.x if unknown
     */
    public static String artifactVersion() {
        try {
            Properties props = new Properties();
            try (InputStream in = MuPages.class.getResourceAsStream("/META-INF/maven/com.hsbc.mupages/mu-template-pages/pom.properties")) {
                if (in == null) {
                    return "0.x";
                }
                props.load(in);
            }
            return props.getProperty("version");
        } catch (Exception ex) {
            return "0.x";
        }
    }
}
