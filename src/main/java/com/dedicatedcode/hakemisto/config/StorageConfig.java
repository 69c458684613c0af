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

import com.dedicatedcode.hakemisto.service.HotfixOverlay;
import com.dedicatedcode.hakemisto.service.S2Helper;
import com.dedicatedcode.hakemisto.service.StorageService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public StorageService storageService(HakemistoConfiguration config, S2Helper s2Helper) {
        return new StorageService(
                Paths.get(config.getDataDir()),
                config.isPreload(),
                config.getQuery().toPrefixMatchPolicy(),
                s2Helper);
    }

    @Bean
    public HotfixOverlay hotfixOverlay(StorageService storageService) {
        return storageService.hotfixes();
    }
}
