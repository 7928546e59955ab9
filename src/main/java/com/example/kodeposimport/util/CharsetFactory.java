package com.example.kodeposimport.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;

public class CharsetFactory {

    private CharsetFactory() {
    }

    /**
     * 严格模式：遇到乱码直接抛异常 (MalformedInputException)，不做替换
     */
    public static CharsetDecoder createStrictDecoder(Charset charset) {
        CharsetDecoder decoder = charset.newDecoder();
        decoder.onMalformedInput(CodingErrorAction.REPORT);
        decoder.onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder;
    }

    /**
     * 上传内容整体解码
     * @throws CharacterCodingException 内容不是合法的 charset 编码
     */
    public static String decode(byte[] content, Charset charset) throws CharacterCodingException {
        return createStrictDecoder(charset).decode(ByteBuffer.wrap(content)).toString();
    }
}
