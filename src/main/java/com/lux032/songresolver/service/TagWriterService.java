package com.lux032.songresolver.service;

import com.lux032.songresolver.model.Song;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.CannotWriteException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 音乐标签写入服务
 * 使用 JAudioTagger 清空原有标签并写入艺术家、标题、专辑
 */
@Slf4j
public class TagWriterService {

    public void writeTags(Path audioFile, Song song) throws IOException {
        log.debug("写入标签: {} --> {}", song, audioFile.getFileName());
        try {
            AudioFile audioFileObj = AudioFileIO.read(audioFile.toFile());
            Tag tag = audioFileObj.createDefaultTag();

            setIfPresent(tag, FieldKey.ARTIST, song.getArtist());
            setIfPresent(tag, FieldKey.TITLE, song.getTitle());
            setIfPresent(tag, FieldKey.ALBUM, song.getAlbum());

            audioFileObj.setTag(tag);
            audioFileObj.commit();
        } catch (CannotReadException | TagException | ReadOnlyFileException
                 | InvalidAudioFrameException | CannotWriteException e) {
            throw new IOException("写入标签失败: " + audioFile.getFileName(), e);
        }
    }

    private static void setIfPresent(Tag tag, FieldKey key, String value) throws TagException {
        if (value != null && !value.isEmpty()) {
            tag.setField(key, value);
        }
    }
}
