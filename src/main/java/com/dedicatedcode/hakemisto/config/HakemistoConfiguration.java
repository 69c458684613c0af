/*
 *  This file is part of hakemisto.
 *
 *  Hakemisto is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Hakemisto is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Hakemisto. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.hakemisto.config;

import com.dedicatedcode.hakemisto.service.PrefixMatchPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "hakemisto")
public class HakemistoConfiguration {

    private String dataDir = "./data";

    /**
     * Read every index once at startup.
     */
    private boolean preload = false;

    private QueryConfiguration query = new QueryConfiguration();

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public boolean isPreload() {
        return preload;
    }

    public void setPreload(boolean preload) {
        this.preload = preload;
    }

    public QueryConfiguration getQuery() {
        return query;
    }

    public void setQuery(QueryConfiguration query) {
        this.query = query;
    }

    public static class QueryConfiguration {

        /**
         * Prefixes at least this long match every name starting with them.
         */
        private int prefixMinFullLength = 3;

        /**
         * Shorter prefixes only match names where prefix length / name length reaches this ratio.
         */
        private double prefixMinRatio = 0.5;

        /**
         * Prefix lookups matching more ids than this fail.
         */
        private int maxPrefixResults = 2000;

        public int getPrefixMinFullLength() {
            return prefixMinFullLength;
        }

        public void setPrefixMinFullLength(int prefixMinFullLength) {
            this.prefixMinFullLength = prefixMinFullLength;
        }

        public double getPrefixMinRatio() {
            return prefixMinRatio;
        }

        public void setPrefixMinRatio(double prefixMinRatio) {
            this.prefixMinRatio = prefixMinRatio;
        }

        public int getMaxPrefixResults() {
            return maxPrefixResults;
        }

        public void setMaxPrefixResults(int maxPrefixResults) {
            this.maxPrefixResults = Math.max(1, maxPrefixResults);
        }

        public PrefixMatchPolicy toPrefixMatchPolicy() {
            return new PrefixMatchPolicy(prefixMinFullLength, prefixMinRatio, maxPrefixResults);
        }
    }
}
