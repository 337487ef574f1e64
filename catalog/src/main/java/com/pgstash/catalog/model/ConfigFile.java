package com.pgstash.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigFile {
    private FileType fileType;
    private String path;

    public enum FileType {
        CONFIG_FILE("config_file"),
        HBA_FILE("hba_file"),
        IDENT_FILE("ident_file"),
        INCLUDE("include");

        private final String settingName;

        FileType(String settingName) {
            this.settingName = settingName;
        }

        public String getSettingName() {
            return settingName;
        }

        /**
         * Missing ident files do not fail a backup.
         */
        public boolean isOptional() {
            return this == IDENT_FILE;
        }
    }
}
