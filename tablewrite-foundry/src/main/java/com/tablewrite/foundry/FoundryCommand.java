package com.tablewrite.foundry;

/**
 * Every command the backend sends to a Foundry client, paired with the reply
 * tag that reports success. Any other reply tag is a failure.
 */
public enum FoundryCommand {

    CREATE_ACTOR("actor", "actor_created"),
    GET_ACTOR("get_actor", "actor_data"),
    DELETE_ACTOR("delete_actor", "actor_deleted"),
    LIST_ACTORS("list_actors", "actors_list"),
    UPDATE_ACTOR("update_actor", "actor_updated"),
    GIVE_ITEMS("give_items", "items_given"),
    REMOVE_ACTOR_ITEMS("remove_actor_items", "items_removed"),

    SEARCH_ITEMS("search_items", "items_found"),
    LIST_COMPENDIUM_ITEMS("list_compendium_items", "compendium_items"),
    GET_ITEM("get_item", "item_data"),

    CREATE_JOURNAL("journal", "journal_created"),
    GET_JOURNAL("get_journal", "journal_data"),
    DELETE_JOURNAL("delete_journal", "journal_deleted"),
    LIST_JOURNALS("list_journals", "journals_list"),
    UPDATE_JOURNAL("update_journal", "journal_updated"),

    CREATE_SCENE("scene", "scene_created"),
    GET_SCENE("get_scene", "scene_data"),
    DELETE_SCENE("delete_scene", "scene_deleted"),
    LIST_SCENES("list_scenes", "scenes_list"),

    GET_OR_CREATE_FOLDER("get_or_create_folder", "folder_result"),
    LIST_FOLDERS("list_folders", "folders_list"),
    DELETE_FOLDER("delete_folder", "folder_deleted"),

    LIST_FILES("list_files", "files_list"),
    UPLOAD_FILE("upload_file", "file_uploaded");

    private final String tag;
    private final String successTag;

    FoundryCommand(String tag, String successTag) {
        this.tag = tag;
        this.successTag = successTag;
    }

    /** Outbound message type. */
    public String tag() {
        return tag;
    }

    /** Reply type a client sends when the command succeeded. */
    public String successTag() {
        return successTag;
    }
}
